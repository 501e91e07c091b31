package edu.nu.tasktracker.exception;

/**
 * Missing, invalid or expired credentials. Mapped to 401 regardless of the
 * underlying cause.
 */
public class UnauthenticatedException extends RuntimeException {
    public UnauthenticatedException(String message) {
        super(message);
    }
}
