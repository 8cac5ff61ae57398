package com.example.profilestore.profile;

/**
 * Session lock lifecycle of a profile held by this process.
 */
public enum LockState {
    UNLOCKED,
    ACQUIRING,
    LOCKED,
    RELEASING,
    /** Persistence disabled; the profile lives in memory only. */
    DEGRADED
}
