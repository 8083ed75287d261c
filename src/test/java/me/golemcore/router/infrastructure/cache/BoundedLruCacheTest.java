package me.golemcore.router.infrastructure.cache;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedLruCacheTest {

    @Test
    void shouldEvictLeastRecentlyUsedEntryWhenFull() {
        BoundedLruCache<String, Integer> cache = new BoundedLruCache<>(2);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.get("a");
        cache.put("c", 3);

        assertTrue(cache.containsKey("a"));
        assertFalse(cache.containsKey("b"));
        assertTrue(cache.containsKey("c"));
        assertEquals(2, cache.size());
    }

    @Test
    void shouldComputeValueOnlyOnce() {
        BoundedLruCache<String, Integer> cache = new BoundedLruCache<>(4);
        AtomicInteger calls = new AtomicInteger();

        int first = cache.computeIfAbsent("k", key -> calls.incrementAndGet());
        int second = cache.computeIfAbsent("k", key -> calls.incrementAndGet());

        assertEquals(1, first);
        assertEquals(1, second);
        assertEquals(1, calls.get());
    }

    @Test
    void shouldReportWhetherPutIfAbsentInserted() {
        BoundedLruCache<String, Boolean> cache = new BoundedLruCache<>(4);

        assertTrue(cache.putIfAbsent("conv", Boolean.TRUE));
        assertFalse(cache.putIfAbsent("conv", Boolean.TRUE));
    }

    @Test
    void shouldEvictOldestBatch() {
        BoundedLruCache<String, Integer> cache = new BoundedLruCache<>(10);
        for (int i = 0; i < 5; i++) {
            cache.put("k" + i, i);
        }

        cache.evictOldest(3);

        assertEquals(List.of("k3", "k4"), cache.keys());
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedLruCache<String, String>(0));
    }
}
