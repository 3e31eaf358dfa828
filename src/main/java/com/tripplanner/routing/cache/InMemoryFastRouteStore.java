package com.tripplanner.routing.cache;

import com.tripplanner.routing.config.RoutingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class InMemoryFastRouteStore implements FastRouteStore {

    private final Map<String, CacheEntry> routes = new ConcurrentHashMap<>();
    private final int maxEntries;
    private final Clock clock;

    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();

    public InMemoryFastRouteStore(RoutingProperties properties, Clock clock) {
        this.maxEntries = properties.getCache().getFastMaxEntries();
        this.clock = clock;
    }

    @Override
    public Optional<byte[]> get(String key) {
        CacheEntry entry = routes.get(key);

        if (entry == null) {
            cacheMisses.incrementAndGet();
            return Optional.empty();
        }

        if (entry.isExpired(clock.instant())) {
            routes.remove(key, entry);
            cacheMisses.incrementAndGet();
            return Optional.empty();
        }

        cacheHits.incrementAndGet();
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, byte[] value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            return;
        }
        if (routes.size() >= maxEntries && !routes.containsKey(key)) {
            evict();
        }
        routes.put(key, new CacheEntry(value, clock.instant().plusSeconds(ttlSeconds)));
    }

    // drops expired entries first, then the ones closest to expiry
    private void evict() {
        Instant now = clock.instant();
        routes.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int excess = routes.size() - maxEntries + 1;
        if (excess <= 0) {
            return;
        }
        routes.entrySet().stream()
                .sorted(Comparator.comparing(e -> e.getValue().expiresAt()))
                .limit(excess)
                .map(Map.Entry::getKey)
                .toList()
                .forEach(routes::remove);
        log.debug("Evicted {} routes from fast store", excess);
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(routes.size(), cacheHits.get(), cacheMisses.get());
    }

    private record CacheEntry(byte[] value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
