package com.tripplanner.routing.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * External service endpoints, timeouts and engine tuning. Timeouts are in milliseconds.
 */
@Data
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {
    private Stadia stadia = new Stadia();
    private Valhalla valhalla = new Valhalla();
    private Osrm osrm = new Osrm();
    private Overpass overpass = new Overpass();
    private OpenTripMap openTripMap = new OpenTripMap();
    private Chain chain = new Chain();
    private Cache cache = new Cache();
    private Scenic scenic = new Scenic();

    @Data
    public static class Stadia {
        private String baseUrl = "https://api.stadiamaps.com/route/v1";
        private String key;
        private int timeout = 10_000;
        private long monthlyQuota = 10_000;

        public boolean hasKey() {
            return key != null && !key.isBlank();
        }
    }

    @Data
    public static class Valhalla {
        private boolean enabled = true;
        private String baseUrl = "http://localhost:8002";
        private int timeout = 10_000;
        private int statusTimeout = 3_000;
    }

    @Data
    public static class Osrm {
        private String baseUrl = "https://router.project-osrm.org";
        private int timeout = 8_000;
    }

    @Data
    public static class Overpass {
        private String url = "https://overpass-api.de/api/interpreter";
        private int timeout = 10_000;
        private int boundaryTimeout = 5_000;
        private int rateLimit = 60;
        private int rateWindowSeconds = 10;
        private long countryCacheSize = 5_000;
    }

    @Data
    public static class OpenTripMap {
        private String baseUrl = "https://api.opentripmap.com/0.1/en";
        private String key;
        private int timeout = 5_000;
        private int radiusMeters = 10_000;

        public boolean hasKey() {
            return key != null && !key.isBlank();
        }
    }

    @Data
    public static class Chain {
        private int budget = 20_000;
    }

    @Data
    public static class Cache {
        private long fastTtlSeconds = 86_400;
        private int fastMaxEntries = 10_000;
        private int persistentTtlDays = 30;
    }

    @Data
    public static class Scenic {
        private int fanOutConcurrency = 5;
        private int sampleCount = 5;
        private double lateralOffsetKm = 50;
        private double searchRadiusKm = 25;
        private double maxDetourPercent = 100;
        private boolean scoreRoutes = true;
        private int scoreTimeout = 30_000;
    }

    @PostConstruct
    public void validate() {
        if (chain.getBudget() <= 0) {
            throw new IllegalStateException("routing.chain.budget must be positive");
        }
        if (stadia.getMonthlyQuota() < 0) {
            throw new IllegalStateException("routing.stadia.monthly-quota must not be negative");
        }

        log.info("==== Loaded Routing Configuration ====");
        log.info("Stadia:");
        log.info("  baseUrl: {}", stadia.getBaseUrl());
        log.info("  key: {}", stadia.hasKey() ? maskKey(stadia.getKey()) : "<none>");
        log.info("  monthlyQuota: {}", stadia.getMonthlyQuota());
        log.info("Valhalla:");
        log.info("  enabled: {}", valhalla.isEnabled());
        log.info("  baseUrl: {}", valhalla.getBaseUrl());
        log.info("OSRM:");
        log.info("  baseUrl: {}", osrm.getBaseUrl());
        log.info("Overpass:");
        log.info("  url: {}", overpass.getUrl());
        log.info("  rateLimit: {} per {}s", overpass.getRateLimit(), overpass.getRateWindowSeconds());
        log.info("OpenTripMap:");
        log.info("  key: {}", openTripMap.hasKey() ? maskKey(openTripMap.getKey()) : "<none>");
        log.info("Chain budget: {} ms", chain.getBudget());

        if (!stadia.hasKey()) {
            log.warn("Stadia Maps key not provided, hosted Valhalla will be skipped");
        }

        log.info("==== Routing Configuration Loaded Successfully ====");
    }

    static String maskKey(String key) {
        if (key == null || key.length() <= 4) return "****";
        return key.substring(0, 4) + "****";
    }
}
