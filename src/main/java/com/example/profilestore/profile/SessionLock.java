package com.example.profilestore.profile;

import com.example.profilestore.model.SessionData;

import java.time.Duration;

/**
 * Soft, timestamp-based lease kept inside the profile document.
 * <p>
 * A lock is free when absent, reclaimable when it carries this process's token, and
 * abandoned only once this acquisition has itself waited longer than {@code timeout} and
 * either the stamp is older than {@code timeout} or the same stamp has gone unrefreshed for
 * that long. The second form covers holders whose clocks run ahead of ours.
 */
public class SessionLock {

    public enum Verdict {
        FREE,
        OWNED,
        ABANDONED,
        HELD
    }

    private final String ownerToken;
    private final Duration timeout;

    public SessionLock(String ownerToken, Duration timeout) {
        this.ownerToken = ownerToken;
        this.timeout = timeout;
    }

    public String getOwnerToken() {
        return ownerToken;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public SessionData stamp(long now) {
        return new SessionData(now, ownerToken);
    }

    public Acquisition begin(long now) {
        return new Acquisition(now);
    }

    /**
     * Tracks what one loader has observed across poll cycles.
     */
    public final class Acquisition {
        private final long startedAt;
        private Long watchedStamp;
        private long watchedSince;

        private Acquisition(long startedAt) {
            this.startedAt = startedAt;
        }

        public Verdict inspect(SessionData lock, long now) {
            if (lock == null) {
                return Verdict.FREE;
            }
            if (ownerToken.equals(lock.getOwnerToken())) {
                return Verdict.OWNED;
            }
            long limit = timeout.toMillis();
            if (watchedStamp == null || watchedStamp != lock.getLastUpdate()) {
                watchedStamp = lock.getLastUpdate();
                watchedSince = now;
            }
            if (now - startedAt <= limit) {
                return Verdict.HELD;
            }
            boolean stale = now - lock.getLastUpdate() > limit;
            boolean unrefreshed = now - watchedSince > limit;
            return stale || unrefreshed ? Verdict.ABANDONED : Verdict.HELD;
        }
    }
}
