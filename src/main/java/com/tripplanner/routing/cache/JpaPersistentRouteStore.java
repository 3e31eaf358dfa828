package com.tripplanner.routing.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.LineString;
import com.tripplanner.routing.model.entity.RouteCacheEntity;
import com.tripplanner.routing.repo.RouteCacheRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaPersistentRouteStore implements PersistentRouteStore {

    private final RouteCacheRepository repository;
    private final RoutingProperties properties;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public Optional<StoredRoute> get(String key) {
        Instant freshAfter = clock.instant().minus(Duration.ofDays(properties.getCache().getPersistentTtlDays()));
        return repository.findByCacheKeyAndCreatedAtAfter(key, freshAfter)
                .map(this::toStoredRoute);
    }

    @Override
    public void upsert(String key, LineString geometry, double distance, double duration, Instant createdAt) {
        String geometryJson;
        try {
            geometryJson = mapper.writeValueAsString(geometry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize route geometry for " + key, e);
        }
        repository.save(new RouteCacheEntity(key, geometryJson, distance, duration, createdAt));
    }

    /**
     * Deletes rows past the freshness window. Returns the number removed.
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getCache().getPersistentTtlDays()));
        int removed = repository.deleteOlderThan(cutoff);
        if (removed > 0) {
            log.info("Purged {} expired cached routes", removed);
        }
        return removed;
    }

    @Scheduled(cron = "${routing.cache.purge-cron:0 30 3 * * *}")
    public void scheduledPurge() {
        purgeExpired();
    }

    private StoredRoute toStoredRoute(RouteCacheEntity entity) {
        try {
            LineString geometry = mapper.readValue(entity.getGeometryJson(), LineString.class);
            return new StoredRoute(geometry, entity.getDistance(), entity.getDuration(), entity.getCreatedAt());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt cached geometry for " + entity.getCacheKey(), e);
        }
    }
}
