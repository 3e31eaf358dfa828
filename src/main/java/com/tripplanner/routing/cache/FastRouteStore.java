package com.tripplanner.routing.cache;

import java.util.Optional;

/**
 * Short-lived key/value store for serialized routes (layer 1).
 */
public interface FastRouteStore {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value, long ttlSeconds);

    CacheStats stats();

    record CacheStats(int entries, long hits, long misses) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0 : (double) hits / total;
        }
    }
}
