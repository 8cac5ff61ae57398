package com.example.profilestore.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis-backed {@link RemoteStore}.
 * <p>
 * Documents live in a hash at {@code profile:<name>} (one field per key);
 * ordered indexes are sorted sets at {@code profile:<name>} scored by value.
 */
@Component
public class RedisRemoteStore implements RemoteStore {

    static final String PREFIX = "profile:";

    private final StringRedisTemplate redis;

    @Autowired
    public RedisRemoteStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String name, String key) {
        Object value = redis.opsForHash().get(PREFIX + name, key);
        return Optional.ofNullable(value).map(Object::toString);
    }

    @Override
    public void put(String name, String key, String value) {
        redis.opsForHash().put(PREFIX + name, key, value);
    }

    @Override
    public void putOrdered(String name, String key, long value) {
        Boolean added = redis.opsForZSet().add(PREFIX + name, key, value);
        if (added == null) {
            throw new IllegalStateException("Redis returned no reply for ZADD on " + name);
        }
    }

    @Override
    public List<String> listSorted(String name, boolean descending, int pageSize) {
        if (pageSize <= 0) return List.of();
        Set<String> keys = descending
                ? redis.opsForZSet().reverseRange(PREFIX + name, 0, pageSize - 1L)
                : redis.opsForZSet().range(PREFIX + name, 0, pageSize - 1L);
        return keys == null ? List.of() : new ArrayList<>(keys);
    }

    @Override
    public void ping() {
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            conn.ping();
        }
    }
}
