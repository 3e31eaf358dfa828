package com.tripplanner.routing.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.routing.config.EngineConfig;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.Provider;
import com.tripplanner.routing.model.RouteResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Read-through cache over a fast store and a persistent store.
 * Store failures are logged and never reach the caller.
 */
@Slf4j
@Component
public class DualLayerRouteCache {

    private final FastRouteStore fastStore;
    private final PersistentRouteStore persistentStore;
    private final Executor backgroundExecutor;
    private final RoutingProperties properties;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public DualLayerRouteCache(FastRouteStore fastStore,
                               PersistentRouteStore persistentStore,
                               @Qualifier(EngineConfig.BACKGROUND_EXECUTOR) Executor backgroundExecutor,
                               RoutingProperties properties,
                               Clock clock) {
        this.fastStore = fastStore;
        this.persistentStore = persistentStore;
        this.backgroundExecutor = backgroundExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public FastRouteStore.CacheStats fastStats() {
        return fastStore.stats();
    }

    /**
     * Returns the cached route for {@code key} or computes, stores and returns it.
     * With {@code bustCache} both reads are skipped but the fresh result is still written.
     */
    public RouteResult getOrCompute(String key, Supplier<RouteResult> compute, boolean bustCache) {
        if (!bustCache) {
            Optional<RouteResult> fast = readFast(key);
            if (fast.isPresent()) {
                log.info("Route cache hit (fast) for {}", key);
                return fast.get();
            }
            Optional<RouteResult> persisted = readPersistent(key);
            if (persisted.isPresent()) {
                log.info("Route cache hit (persistent) for {}", key);
                writeFast(key, persisted.get());
                return persisted.get();
            }
        }

        RouteResult computed = compute.get();
        writeFast(key, computed);
        writePersistentAsync(key, computed);
        return computed;
    }

    private Optional<RouteResult> readFast(String key) {
        try {
            Optional<byte[]> bytes = fastStore.get(key);
            if (bytes.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(mapper.readValue(bytes.get(), RouteResult.class));
        } catch (Exception e) {
            log.warn("Fast store read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<RouteResult> readPersistent(String key) {
        try {
            return persistentStore.get(key)
                    .map(stored -> new RouteResult(stored.geometry(), stored.distance(), stored.duration(), Provider.CACHE));
        } catch (Exception e) {
            log.warn("Persistent store read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeFast(String key, RouteResult route) {
        try {
            fastStore.set(key, mapper.writeValueAsBytes(route), properties.getCache().getFastTtlSeconds());
        } catch (Exception e) {
            log.warn("Fast store write failed for {}: {}", key, e.getMessage());
        }
    }

    private void writePersistentAsync(String key, RouteResult route) {
        try {
            backgroundExecutor.execute(() -> {
                try {
                    persistentStore.upsert(key, route.geometry(), route.distance(), route.duration(), clock.instant());
                } catch (Exception e) {
                    log.warn("Persistent store write failed for {}: {}", key, e.getMessage());
                }
            });
        } catch (Exception e) {
            log.warn("Could not schedule persistent write for {}: {}", key, e.getMessage());
        }
    }
}
