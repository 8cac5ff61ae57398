package com.example.profilestore.store;

/**
 * Thrown when a remote store call still fails after every retry attempt.
 */
public class StoreUnavailableException extends RuntimeException {

    private final int attempts;

    public StoreUnavailableException(String operation, int attempts, Throwable cause) {
        super(operation + " failed after " + attempts + " attempt(s): " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
