package com.example.profilestore.profile;

import com.example.profilestore.model.SessionData;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SessionLockTest {

    private final SessionLock lock = new SessionLock("me", Duration.ofSeconds(60));

    @Test
    void testInspect_FreeOwnedAndFresh() {
        SessionLock.Acquisition acq = lock.begin(1_000);

        assertEquals(SessionLock.Verdict.FREE, acq.inspect(null, 1_000));
        assertEquals(SessionLock.Verdict.OWNED, acq.inspect(new SessionData(1_000, "me"), 1_000));
        assertEquals(SessionLock.Verdict.HELD, acq.inspect(new SessionData(1_000, "other"), 30_000));
    }

    @Test
    void testInspect_StampOlderThanTimeoutIsAbandoned() {
        SessionLock.Acquisition acq = lock.begin(0);

        assertEquals(SessionLock.Verdict.HELD, acq.inspect(new SessionData(0, "other"), 60_000));
        assertEquals(SessionLock.Verdict.ABANDONED, acq.inspect(new SessionData(0, "other"), 60_001));
    }

    @Test
    void testInspect_StaleStampStillRequiresThisAcquisitionToWaitOutTimeout() {
        SessionLock.Acquisition acq = lock.begin(100_000);

        assertEquals(SessionLock.Verdict.HELD, acq.inspect(new SessionData(0, "other"), 100_000));
        assertEquals(SessionLock.Verdict.HELD, acq.inspect(new SessionData(0, "other"), 160_000));
        assertEquals(SessionLock.Verdict.ABANDONED, acq.inspect(new SessionData(0, "other"), 160_001));
    }

    @Test
    void testInspect_UnrefreshedFutureStampIsAbandonedAfterWatchingForTimeout() {
        SessionLock.Acquisition acq = lock.begin(0);
        long skewed = 10_000_000; // holder clock far ahead of ours

        assertEquals(SessionLock.Verdict.HELD, acq.inspect(new SessionData(skewed, "other"), 0));
        assertEquals(SessionLock.Verdict.HELD, acq.inspect(new SessionData(skewed, "other"), 60_000));
        assertEquals(SessionLock.Verdict.ABANDONED, acq.inspect(new SessionData(skewed, "other"), 60_001));
    }

    @Test
    void testInspect_RefreshedStampRestartsTheWatch() {
        SessionLock.Acquisition acq = lock.begin(0);
        long skewed = 10_000_000;

        acq.inspect(new SessionData(skewed, "other"), 0);
        assertEquals(SessionLock.Verdict.HELD, acq.inspect(new SessionData(skewed + 5, "other"), 50_000));
        assertEquals(SessionLock.Verdict.HELD, acq.inspect(new SessionData(skewed + 5, "other"), 100_000));
        assertEquals(SessionLock.Verdict.ABANDONED, acq.inspect(new SessionData(skewed + 5, "other"), 110_001));
    }

    @Test
    void testStamp() {
        SessionData stamp = lock.stamp(42);

        assertEquals(42, stamp.getLastUpdate());
        assertEquals("me", stamp.getOwnerToken());
    }
}
