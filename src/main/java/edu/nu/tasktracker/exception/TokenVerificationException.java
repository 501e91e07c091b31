package edu.nu.tasktracker.exception;

/**
 * Raised when a token cannot be accepted. The reason is kept distinct so that
 * callers can decide between refreshing and rejecting outright.
 */
public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        INVALID_SIGNATURE,
        WRONG_TOKEN_TYPE,
        EXPIRED,
        USER_NOT_FOUND
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
