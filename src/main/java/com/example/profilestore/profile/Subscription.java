package com.example.profilestore.profile;

/**
 * Handle returned by {@link ProfileEvents}; closing it stops delivery.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
