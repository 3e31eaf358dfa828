package com.tripplanner.routing.repo;

import com.tripplanner.routing.cache.JpaPersistentRouteStore;
import com.tripplanner.routing.cache.PersistentRouteStore;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.LineString;
import com.tripplanner.routing.model.entity.RouteCacheEntity;
import com.tripplanner.routing.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class RouteCacheRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");
    private static final String KEY = "driving:scenic:2.3522,48.8566|4.8357,45.7640";

    @Autowired
    private RouteCacheRepository repository;

    private MutableClock clock;
    private JpaPersistentRouteStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new JpaPersistentRouteStore(repository, new RoutingProperties(), clock);
    }

    @Test
    void testFindFresh() {
        repository.saveAndFlush(new RouteCacheEntity(KEY, "{}", 465000, 16200, NOW.minus(Duration.ofDays(2))));

        assertTrue(repository.findByCacheKeyAndCreatedAtAfter(KEY, NOW.minus(Duration.ofDays(30))).isPresent());
        assertTrue(repository.findByCacheKeyAndCreatedAtAfter(KEY, NOW.minus(Duration.ofDays(1))).isEmpty());
    }

    @Test
    void testStore_UpsertThenGet() {
        LineString geometry = LineString.of(List.of(new double[]{2.3522, 48.8566}, new double[]{4.8357, 45.764}));

        store.upsert(KEY, geometry, 465000, 16200, NOW);
        store.upsert(KEY, geometry, 470000, 16500, NOW);

        Optional<PersistentRouteStore.StoredRoute> stored = store.get(KEY);
        assertTrue(stored.isPresent());
        assertEquals(470000, stored.get().distance());
        assertEquals(2, stored.get().geometry().size());
        assertArrayEquals(new double[]{4.8357, 45.764}, stored.get().geometry().coordinates().get(1));
        assertEquals(1, repository.count());
    }

    @Test
    void testStore_ExpiredEntryIsMissAndPurged() {
        LineString geometry = LineString.of(List.of(new double[]{2.3522, 48.8566}, new double[]{4.8357, 45.764}));
        store.upsert(KEY, geometry, 465000, 16200, NOW);
        store.upsert("driving:default:0.0000,0.0000|1.0000,1.0000", geometry, 1000, 60, NOW.plus(Duration.ofDays(20)));

        clock.advance(Duration.ofDays(31));

        assertTrue(store.get(KEY).isEmpty());
        assertEquals(1, store.purgeExpired());
        assertEquals(1, repository.count());
    }
}
