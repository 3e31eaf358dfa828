package com.tripplanner.routing.service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.tripplanner.routing.client.OverpassClient;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.Coordinate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Coordinate to ISO 3166-1 country code, memoized per ~11 m cell.
 */
@Slf4j
@Service
public class CountryResolver {

    public static final String UNKNOWN = "unknown";

    private final OverpassClient overpassClient;
    private final Cache<String, String> memo;

    public CountryResolver(OverpassClient overpassClient, RoutingProperties properties) {
        this.overpassClient = overpassClient;
        this.memo = CacheBuilder.newBuilder()
                .maximumSize(properties.getOverpass().getCountryCacheSize())
                .recordStats()
                .build();
    }

    /**
     * Never throws; returns {@link #UNKNOWN} when the boundary lookup fails or finds nothing.
     * Unknown results are not memoized.
     */
    public String resolveCountry(Coordinate point) {
        String key = memoKey(point);
        String cached = memo.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        Optional<String> country = overpassClient.countryAt(point);
        if (country.isEmpty()) {
            log.debug("Country unknown at {}", key);
            return UNKNOWN;
        }
        memo.put(key, country.get());
        return country.get();
    }

    public String resolveCountry(double latitude, double longitude) {
        return resolveCountry(new Coordinate(latitude, longitude));
    }

    public static boolean isKnown(String countryCode) {
        return countryCode != null && !UNKNOWN.equals(countryCode);
    }

    long memoSize() {
        return memo.size();
    }

    private static String memoKey(Coordinate point) {
        return String.format(Locale.US, "%.4f,%.4f", point.latitude(), point.longitude());
    }
}
