package com.example.profilestore.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisRemoteStoreTest {

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private HashOperations<String, Object, Object> hashOps;

    @Mock
    private ZSetOperations<String, String> zsetOps;

    private RedisRemoteStore store;

    @BeforeEach
    void setUp() {
        store = new RedisRemoteStore(redis);
    }

    @Test
    void testGetAndPut_UseHashFieldPerVersion() {
        when(redis.opsForHash()).thenReturn(hashOps);
        when(hashOps.get("profile:S:v1:p1", "42")).thenReturn("{\"data\":{}}");

        store.put("S:v1:p1", "43", "{}");
        Optional<String> value = store.get("S:v1:p1", "42");

        assertEquals(Optional.of("{\"data\":{}}"), value);
        verify(hashOps).put("profile:S:v1:p1", "43", "{}");
    }

    @Test
    void testGet_AbsentField() {
        when(redis.opsForHash()).thenReturn(hashOps);

        assertTrue(store.get("S:v1:p1", "1").isEmpty());
    }

    @Test
    void testPutOrdered_AddsScoredMember() {
        when(redis.opsForZSet()).thenReturn(zsetOps);
        when(zsetOps.add("profile:S:v1:p1:versions", "42", 42.0)).thenReturn(true);

        store.putOrdered("S:v1:p1:versions", "42", 42);

        verify(zsetOps).add("profile:S:v1:p1:versions", "42", 42.0);
    }

    @Test
    void testPutOrdered_NoReplyIsAFailure() {
        when(redis.opsForZSet()).thenReturn(zsetOps);
        when(zsetOps.add(anyString(), anyString(), anyDouble())).thenReturn(null);

        assertThrows(IllegalStateException.class, () -> store.putOrdered("x", "1", 1));
    }

    @Test
    void testListSorted_DescendingUsesReverseRange() {
        when(redis.opsForZSet()).thenReturn(zsetOps);
        when(zsetOps.reverseRange("profile:L", 0, 1)).thenReturn(new LinkedHashSet<>(List.of("9", "8")));

        assertEquals(List.of("9", "8"), store.listSorted("L", true, 2));
        verify(zsetOps, never()).range(anyString(), anyLong(), anyLong());
    }

    @Test
    void testListSorted_AscendingAndEmpty() {
        when(redis.opsForZSet()).thenReturn(zsetOps);
        when(zsetOps.range("profile:L", 0, 0)).thenReturn(null);

        assertEquals(List.of(), store.listSorted("L", false, 1));
        assertEquals(List.of(), store.listSorted("L", false, 0));
    }
}
