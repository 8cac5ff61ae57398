package com.example.profilestore.profile;

/**
 * A persisted profile (or ledger entry) could not be decoded into the expected shape.
 */
public class ProfileDecodeException extends RuntimeException {
    public ProfileDecodeException(String message) {
        super(message);
    }

    public ProfileDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
