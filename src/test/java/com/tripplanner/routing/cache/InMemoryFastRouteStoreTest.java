package com.tripplanner.routing.cache;

import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFastRouteStoreTest {

    private MutableClock clock;
    private InMemoryFastRouteStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T10:00:00Z"));
        RoutingProperties properties = new RoutingProperties();
        properties.getCache().setFastMaxEntries(3);
        store = new InMemoryFastRouteStore(properties, clock);
    }

    @Test
    void testGet_MissThenHit() {
        assertTrue(store.get("k").isEmpty());

        store.set("k", bytes("route"), 60);

        assertEquals("route", new String(store.get("k").orElseThrow(), StandardCharsets.UTF_8));
        FastRouteStore.CacheStats stats = store.stats();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(0.5, stats.hitRate(), 1e-9);
    }

    @Test
    void testGet_ExpiresAfterTtl() {
        store.set("k", bytes("route"), 60);

        clock.advance(Duration.ofSeconds(59));
        assertTrue(store.get("k").isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(store.get("k").isEmpty());
        assertEquals(0, store.stats().entries());
    }

    @Test
    void testSet_EvictsSoonestToExpireWhenFull() {
        store.set("a", bytes("a"), 10);
        store.set("b", bytes("b"), 100);
        store.set("c", bytes("c"), 100);

        store.set("d", bytes("d"), 100);

        assertTrue(store.get("a").isEmpty());
        assertTrue(store.get("b").isPresent());
        assertTrue(store.get("d").isPresent());
        assertEquals(3, store.stats().entries());
    }

    @Test
    void testSet_OverwriteDoesNotEvict() {
        store.set("a", bytes("a"), 100);
        store.set("b", bytes("b"), 100);
        store.set("c", bytes("c"), 100);

        store.set("a", bytes("a2"), 100);

        assertEquals("a2", new String(store.get("a").orElseThrow(), StandardCharsets.UTF_8));
        assertTrue(store.get("b").isPresent());
        assertTrue(store.get("c").isPresent());
    }

    @Test
    void testStats_EmptyStoreHasZeroHitRate() {
        assertEquals(0, store.stats().entries());
        assertEquals(0.0, store.stats().hitRate());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
