package com.example.profilestore.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with a fixed delay between attempts.
 */
public class StoreRetrier {

    private static final Logger logger = LoggerFactory.getLogger(StoreRetrier.class);

    private final int maxAttempts;
    private final Duration delay;

    public StoreRetrier(int maxAttempts, Duration delay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay == null ? Duration.ZERO : delay;
    }

    public <T> T call(String operation, Supplier<T> action) {
        RuntimeException last = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            try {
                return action.get();
            } catch (RuntimeException e) {
                last = e;
                logger.warn("{} failed (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts && !pause()) {
                    break;
                }
            }
        }
        throw new StoreUnavailableException(operation, attempt, last);
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private boolean pause() {
        if (delay.isZero() || delay.isNegative()) return true;
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
