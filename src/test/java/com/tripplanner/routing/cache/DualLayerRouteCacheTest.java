package com.tripplanner.routing.cache;

import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.LineString;
import com.tripplanner.routing.model.Provider;
import com.tripplanner.routing.model.RouteResult;
import com.tripplanner.routing.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DualLayerRouteCacheTest {

    private static final String KEY = "driving:default:2.3522,48.8566|4.8357,45.7640";
    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    private InMemoryFastRouteStore fastStore;
    private PersistentRouteStore persistentStore;
    private DualLayerRouteCache cache;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        RoutingProperties properties = new RoutingProperties();
        fastStore = new InMemoryFastRouteStore(properties, clock);
        persistentStore = mock(PersistentRouteStore.class);
        when(persistentStore.get(anyString())).thenReturn(Optional.empty());
        cache = new DualLayerRouteCache(fastStore, persistentStore, Runnable::run, properties, clock);
    }

    @Test
    @DisplayName("Two identical calls compute once and return equal routes")
    void testGetOrCompute_Idempotent() {
        AtomicInteger computeCount = new AtomicInteger();
        Supplier<RouteResult> compute = () -> {
            computeCount.incrementAndGet();
            return route(Provider.OSRM);
        };

        RouteResult first = cache.getOrCompute(KEY, compute, false);
        RouteResult second = cache.getOrCompute(KEY, compute, false);

        assertEquals(1, computeCount.get());
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(route(Provider.OSRM), second);
        verify(persistentStore, times(1)).upsert(eq(KEY), any(), eq(465000.0), eq(16200.0), eq(NOW));
    }

    @Test
    void testGetOrCompute_CallerCannotAlterCachedGeometry() {
        RouteResult first = cache.getOrCompute(KEY, () -> route(Provider.OSRM), false);
        first.geometry().coordinates().get(0)[0] = 99.0;

        RouteResult second = cache.getOrCompute(KEY, () -> fail("should not compute"), false);

        assertEquals(route(Provider.OSRM), second);
        assertEquals(first, second);
    }

    @Test
    void testGetOrCompute_PersistentHitIsTaggedAndBackfillsFastLayer() {
        RouteResult stored = route(Provider.STADIA);
        when(persistentStore.get(KEY)).thenReturn(Optional.of(new PersistentRouteStore.StoredRoute(
                stored.geometry(), stored.distance(), stored.duration(), NOW.minusSeconds(3600))));

        RouteResult result = cache.getOrCompute(KEY, () -> fail("should not compute"), false);

        assertEquals(Provider.CACHE, result.provider());
        assertEquals(465000.0, result.distance());
        assertTrue(fastStore.get(KEY).isPresent());
    }

    @Test
    void testGetOrCompute_BustCacheSkipsReadsButWrites() {
        cache.getOrCompute(KEY, () -> route(Provider.OSRM), false);
        AtomicInteger computeCount = new AtomicInteger();

        RouteResult result = cache.getOrCompute(KEY, () -> {
            computeCount.incrementAndGet();
            return route(Provider.STADIA);
        }, true);

        assertEquals(1, computeCount.get());
        assertEquals(Provider.STADIA, result.provider());
        // the fresh result replaced the old one
        assertEquals(Provider.STADIA, cache.getOrCompute(KEY, () -> fail("cached"), false).provider());
        verify(persistentStore, times(2)).upsert(eq(KEY), any(), anyDouble(), anyDouble(), any());
    }

    @Test
    @DisplayName("Store failures never reach the caller")
    void testGetOrCompute_StoreFailuresAreIgnored() {
        when(persistentStore.get(anyString())).thenThrow(new IllegalStateException("db down"));
        doThrow(new IllegalStateException("db down")).when(persistentStore)
                .upsert(anyString(), any(), anyDouble(), anyDouble(), any());

        RouteResult result = cache.getOrCompute(KEY, () -> route(Provider.OSRM), false);

        assertEquals(Provider.OSRM, result.provider());
    }

    @Test
    void testGetOrCompute_ComputeFailurePropagates() {
        assertThrows(IllegalStateException.class,
                () -> cache.getOrCompute(KEY, () -> { throw new IllegalStateException("no route"); }, false));
        verify(persistentStore, never()).upsert(anyString(), any(), anyDouble(), anyDouble(), any());
    }

    private static RouteResult route(Provider provider) {
        return new RouteResult(LineString.of(List.of(
                new double[]{2.3522, 48.8566},
                new double[]{3.5, 47.1},
                new double[]{4.8357, 45.7640})), 465000.0, 16200.0, provider);
    }
}
