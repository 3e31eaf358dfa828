package com.tripplanner.routing.cache;

import com.tripplanner.routing.model.LineString;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable route store (layer 2). Entries past the freshness window are treated as absent.
 */
public interface PersistentRouteStore {

    Optional<StoredRoute> get(String key);

    void upsert(String key, LineString geometry, double distance, double duration, Instant createdAt);

    record StoredRoute(LineString geometry, double distance, double duration, Instant createdAt) {
    }
}
