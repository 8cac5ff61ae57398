package com.example.profilestore.store;

import java.util.List;
import java.util.Optional;

/**
 * Remote key-value store used for profile persistence.
 * <p>
 * Writes are atomic per key only. There is no compare-and-swap and no locking;
 * any call may fail transiently and callers wrap it with {@link StoreRetrier}.
 */
public interface RemoteStore {
    Optional<String> get(String name, String key);
    void put(String name, String key, String value);

    /**
     * Write an entry into the ordered index {@code name}, ordered by {@code value}.
     */
    void putOrdered(String name, String key, long value);

    /**
     * Keys of the ordered index {@code name}, sorted by their value, at most {@code pageSize}.
     */
    List<String> listSorted(String name, boolean descending, int pageSize);

    /**
     * Round-trip to the backend; throws if it is unreachable.
     */
    void ping();
}
