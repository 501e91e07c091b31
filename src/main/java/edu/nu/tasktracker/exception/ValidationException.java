package edu.nu.tasktracker.exception;

/**
 * Malformed or rejected input. Carries the offending field when there is one so
 * the error response can report it.
 */
public class ValidationException extends RuntimeException {
    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
