package edu.nu.tasktracker.exception;

/**
 * Record absent, or present but not accessible to the caller. Both cases map to
 * the same 404 response.
 */
public class ResourceNotFoundException extends RuntimeException {
    public ResourceNotFoundException(String message) {
        super(message);
    }
}
