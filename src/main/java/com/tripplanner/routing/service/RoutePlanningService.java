package com.tripplanner.routing.service;

import com.tripplanner.routing.cache.DualLayerRouteCache;
import com.tripplanner.routing.cache.FastRouteStore;
import com.tripplanner.routing.cache.RouteCacheKey;
import com.tripplanner.routing.client.routing.RoutingCall;
import com.tripplanner.routing.config.EngineConfig;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.error.InvalidRouteRequestException;
import com.tripplanner.routing.model.Coordinate;
import com.tripplanner.routing.model.FeatureDensityScore;
import com.tripplanner.routing.model.LineString;
import com.tripplanner.routing.model.RouteResult;
import com.tripplanner.routing.model.StylePreference;
import com.tripplanner.routing.model.TransportProfile;
import com.tripplanner.routing.model.dto.UsageSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the route engine: cache, waypoint biasing, provider chain.
 */
@Slf4j
@Service
public class RoutePlanningService {

    private final DualLayerRouteCache routeCache;
    private final ProviderChain providerChain;
    private final WaypointSelector waypointSelector;
    private final ScenicFeatureFinder featureFinder;
    private final CountryResolver countryResolver;
    private final RoutingProperties properties;
    private final Executor backgroundExecutor;

    public RoutePlanningService(DualLayerRouteCache routeCache,
                                ProviderChain providerChain,
                                WaypointSelector waypointSelector,
                                ScenicFeatureFinder featureFinder,
                                CountryResolver countryResolver,
                                RoutingProperties properties,
                                @Qualifier(EngineConfig.BACKGROUND_EXECUTOR) Executor backgroundExecutor) {
        this.routeCache = routeCache;
        this.providerChain = providerChain;
        this.waypointSelector = waypointSelector;
        this.featureFinder = featureFinder;
        this.countryResolver = countryResolver;
        this.properties = properties;
        this.backgroundExecutor = backgroundExecutor;
    }

    /**
     * Road route through the given coordinates.
     *
     * @param preference null for the default route
     * @param bustCache  skip cache reads; the result is still cached
     * @throws InvalidRouteRequestException fewer than two coordinates
     * @throws com.tripplanner.routing.error.RoutingUnavailableException no provider could route
     */
    public RouteResult getRoute(List<Coordinate> coordinates, TransportProfile profile,
                                StylePreference preference, boolean bustCache) {
        validate(coordinates);
        TransportProfile effectiveProfile = profile == null ? TransportProfile.DRIVING : profile;
        String key = RouteCacheKey.of(coordinates, effectiveProfile, preference);

        log.info("=== ROUTE REQUEST: {} stops, profile={}, style={}, bustCache={} ===",
                coordinates.size(), effectiveProfile.id(), StylePreference.tokenOf(preference), bustCache);
        return routeCache.getOrCompute(key, () -> compute(coordinates, effectiveProfile, preference), bustCache);
    }

    /**
     * One default route per consecutive pair of locations.
     */
    public List<RouteResult> getBatchRoutes(List<Coordinate> locations, TransportProfile profile) {
        validate(locations);
        List<RouteResult> routes = new ArrayList<>();
        for (int i = 0; i < locations.size() - 1; i++) {
            routes.add(getRoute(List.of(locations.get(i), locations.get(i + 1)), profile, null, false));
        }
        log.info("Batch of {} legs routed", routes.size());
        return routes;
    }

    public FeatureDensityScore scoreRoute(LineString geometry, String countryCode) {
        if (geometry == null || geometry.size() < 2) {
            throw new InvalidRouteRequestException("Geometry needs at least 2 positions");
        }
        return featureFinder.scoreRouteByFeatureDensity(geometry, countryCode);
    }

    public UsageSummary.CacheUsage cacheUsage() {
        FastRouteStore.CacheStats stats = routeCache.fastStats();
        return UsageSummary.CacheUsage.builder()
                .entries(stats.entries())
                .hits(stats.hits())
                .misses(stats.misses())
                .hitRate(stats.hitRate())
                .build();
    }

    private RouteResult compute(List<Coordinate> coordinates, TransportProfile profile, StylePreference preference) {
        List<Coordinate> stops = withWaypoints(coordinates, preference);
        RouteResult route = providerChain.route(new RoutingCall(stops, profile, preference));

        if (preference != null && preference.isDetourStyle() && properties.getScenic().isScoreRoutes()) {
            scoreInBackground(route, coordinates.get(0));
        }
        return route;
    }

    // only a plain start/end request gets waypoints; explicit intermediate stops are kept as given
    List<Coordinate> withWaypoints(List<Coordinate> coordinates, StylePreference preference) {
        if (preference == null || !preference.isDetourStyle() || coordinates.size() != 2) {
            return coordinates;
        }
        Coordinate start = coordinates.get(0);
        Coordinate end = coordinates.get(1);
        List<Coordinate> waypoints;
        try {
            waypoints = preference == StylePreference.SCENIC
                    ? waypointSelector.findScenicWaypoints(start, end)
                    : waypointSelector.findPOIRichWaypoints(start, end, properties.getScenic().getMaxDetourPercent());
        } catch (Exception e) {
            log.warn("Waypoint search failed, routing directly: {}", e.getMessage());
            waypoints = List.of();
        }
        if (waypoints.isEmpty()) {
            return coordinates;
        }
        List<Coordinate> stops = new ArrayList<>(waypoints.size() + 2);
        stops.add(start);
        stops.addAll(waypoints);
        stops.add(end);
        log.info("Inserted {} {} waypoint(s)", waypoints.size(), preference.id());
        return stops;
    }

    private void scoreInBackground(RouteResult route, Coordinate start) {
        try {
            CompletableFuture
                    .supplyAsync(() -> {
                        String country = countryResolver.resolveCountry(start);
                        return featureFinder.scoreRouteByFeatureDensity(route.geometry(),
                                CountryResolver.isKnown(country) ? country : null);
                    }, backgroundExecutor)
                    .orTimeout(properties.getScenic().getScoreTimeout(), TimeUnit.MILLISECONDS)
                    .whenComplete((score, error) -> {
                        if (error != null) {
                            log.warn("Route density scoring did not finish: {}", error.toString());
                        } else {
                            log.info("Route density score {} ({} features, top {})",
                                    score.score(), score.featureCount(), score.topFeatures());
                        }
                    });
        } catch (Exception e) {
            log.warn("Could not schedule route density scoring: {}", e.getMessage());
        }
    }

    private static void validate(List<Coordinate> coordinates) {
        if (coordinates == null || coordinates.size() < 2) {
            throw new InvalidRouteRequestException("At least 2 coordinates are required");
        }
        if (coordinates.stream().anyMatch(Objects::isNull)) {
            throw new InvalidRouteRequestException("Coordinates must not be null");
        }
        for (Coordinate c : coordinates) {
            if (Math.abs(c.latitude()) > 90 || Math.abs(c.longitude()) > 180) {
                throw new InvalidRouteRequestException("Coordinate out of range: " + c);
            }
        }
    }
}
