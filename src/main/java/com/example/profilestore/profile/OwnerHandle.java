package com.example.profilestore.profile;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Live reference to the entity owning a profile. Detaching it cancels a pending
 * lock acquisition, including one parked in a poll wait.
 */
public final class OwnerHandle {

    private final String ownerId;
    private final CountDownLatch detached = new CountDownLatch(1);

    public OwnerHandle(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        this.ownerId = ownerId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void detach() {
        detached.countDown();
    }

    public boolean isDetached() {
        return detached.getCount() == 0;
    }

    /**
     * Wait up to {@code timeout} for the owner to detach.
     *
     * @return true if the owner detached (or the waiting thread was interrupted)
     */
    public boolean awaitDetached(Duration timeout) {
        try {
            return detached.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
