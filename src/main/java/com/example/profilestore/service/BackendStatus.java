package com.example.profilestore.service;

import lombok.Value;

import java.time.Instant;

/**
 * Outcome of the startup connectivity check against the remote store.
 */
@Value
public class BackendStatus {
    boolean available;
    Instant checkedAt;
    String error;

    public static BackendStatus up(Instant at) {
        return new BackendStatus(true, at, null);
    }

    public static BackendStatus down(Instant at, String error) {
        return new BackendStatus(false, at, error);
    }
}
