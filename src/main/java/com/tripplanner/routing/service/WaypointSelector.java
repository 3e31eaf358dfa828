package com.tripplanner.routing.service;

import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.Coordinate;
import com.tripplanner.routing.model.FeatureType;
import com.tripplanner.routing.model.ScenicFeature;
import com.tripplanner.routing.model.ScoredWaypoint;
import com.tripplanner.routing.util.BoundedFanOut;
import com.tripplanner.routing.util.GeoUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks intermediate stops that bend a route toward scenery without leaving the start country.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WaypointSelector {

    static final double CORRIDOR_MIN_KM = 20;
    static final double CORRIDOR_MAX_KM = 150;
    static final double MIDPOINT_RADIUS_KM = 100;
    static final double MAX_DETOUR_RATIO = 0.5;
    static final double SECOND_WAYPOINT_MIN_SCORE = 50;
    static final double SECOND_WAYPOINT_MIN_SEPARATION_KM = 50;
    static final int MAX_SCENIC_WAYPOINTS = 2;
    static final int MIN_POI_DENSITY = 5;
    static final double[] POI_OFFSETS = {0.3, 0.5, 0.7};

    private final ScenicFeatureFinder featureFinder;
    private final CountryResolver countryResolver;
    private final RoutingProperties properties;

    /**
     * Corridor scoring. Deterministic for identical input; result ordered by distance from start.
     */
    public List<ScenicFeature> selectWaypoints(Coordinate start, Coordinate end,
                                               List<ScenicFeature> features, int maxWaypoints) {
        int limit = Math.min(maxWaypoints, MAX_SCENIC_WAYPOINTS);
        if (features.isEmpty() || limit <= 0) {
            return List.of();
        }
        Coordinate midpoint = GeoUtils.midpoint(start, end);
        double directKm = GeoUtils.haversineKm(start, end);

        List<ScoredWaypoint> ranked = features.stream()
                .map(f -> score(f, start, end, midpoint, directKm))
                .filter(w -> w.score() > 0)
                .sorted(Comparator.comparingDouble(ScoredWaypoint::score).reversed()
                        .thenComparingDouble(ScoredWaypoint::distanceFromStartKm)
                        .thenComparing(w -> w.feature().name()))
                .toList();
        if (ranked.isEmpty()) {
            return List.of();
        }

        List<ScoredWaypoint> selected = new ArrayList<>();
        ScoredWaypoint best = ranked.get(0);
        selected.add(best);
        if (limit > 1) {
            ranked.stream()
                    .skip(1)
                    .filter(w -> w.score() > SECOND_WAYPOINT_MIN_SCORE)
                    .filter(w -> GeoUtils.haversineKm(w.feature().coordinate(), best.feature().coordinate())
                            > SECOND_WAYPOINT_MIN_SEPARATION_KM)
                    .findFirst()
                    .ifPresent(selected::add);
        }

        return selected.stream()
                .sorted(Comparator.comparingDouble(ScoredWaypoint::distanceFromStartKm))
                .map(ScoredWaypoint::feature)
                .toList();
    }

    ScoredWaypoint score(ScenicFeature feature, Coordinate start, Coordinate end,
                         Coordinate midpoint, double directKm) {
        Coordinate p = feature.coordinate();
        double fromLine = GeoUtils.perpendicularDistanceKm(p, start, end);
        double fromStart = GeoUtils.haversineKm(start, p);
        double viaKm = fromStart + GeoUtils.haversineKm(p, end);

        double score = 0;
        if (fromLine > CORRIDOR_MIN_KM && fromLine < CORRIDOR_MAX_KM) {
            score += 100;
        }
        if (GeoUtils.haversineKm(p, midpoint) < MIDPOINT_RADIUS_KM) {
            score += 50;
        }
        if (directKm > 0 && (viaKm - directKm) / directKm > MAX_DETOUR_RATIO) {
            score -= 100;
        }
        if (feature.type() == FeatureType.SKI_RESORT) {
            score += 30;
        } else if (feature.type() == FeatureType.NATIONAL_PARK) {
            score += 20;
        }
        return new ScoredWaypoint(feature, score, fromLine, fromStart);
    }

    /**
     * Scenic corridor waypoints between two points in the same country; empty across borders or when unknown.
     */
    public List<Coordinate> findScenicWaypoints(Coordinate start, Coordinate end) {
        Optional<String> country = sharedCountry(start, end);
        if (country.isEmpty()) {
            return List.of();
        }

        RoutingProperties.Scenic scenic = properties.getScenic();
        List<Coordinate> samples = new ArrayList<>();
        int count = scenic.getSampleCount();
        for (int i = 1; i <= count; i++) {
            Coordinate onLine = GeoUtils.interpolate(start, end, (double) i / (count + 1));
            samples.add(onLine);
            samples.add(GeoUtils.lateralOffset(onLine, start, end, scenic.getLateralOffsetKm()));
            samples.add(GeoUtils.lateralOffset(onLine, start, end, -scenic.getLateralOffsetKm()));
        }

        // country check after fan-in so boundary lookups never nest inside the sample fan-out
        List<List<ScenicFeature>> found = BoundedFanOut.map(samples, scenic.getFanOutConcurrency(),
                p -> featureFinder.findFeaturesNear(p, null, scenic.getSearchRadiusKm()));
        Map<String, ScenicFeature> unique = new LinkedHashMap<>();
        found.forEach(list -> list.forEach(f -> unique.putIfAbsent(f.name(), f)));
        List<ScenicFeature> candidates = featureFinder.keepInCountry(new ArrayList<>(unique.values()), country.get());

        List<ScenicFeature> waypoints = selectWaypoints(start, end, candidates, MAX_SCENIC_WAYPOINTS);
        log.info("Scenic waypoints in {}: {} of {} candidates in country from {} samples, selected {}",
                country.get(), candidates.size(), unique.size(), samples.size(),
                waypoints.stream().map(ScenicFeature::label).toList());
        return waypoints.stream().map(ScenicFeature::coordinate).toList();
    }

    /**
     * Densest of six sideways samples (30, 50 and 70 percent of the route vector, both sides) with more than
     * five POIs around it. Every sample is country-checked and queried; {@code maxDetourPercent} only rejects
     * a dense sample whose straight-line detour is larger.
     */
    public Optional<Coordinate> selectPOIRichWaypoint(Coordinate start, Coordinate end,
                                                      String countryCode, double maxDetourPercent) {
        Coordinate mid = GeoUtils.midpoint(start, end);
        double dLat = end.latitude() - start.latitude();
        double dLon = end.longitude() - start.longitude();
        double directKm = GeoUtils.haversineKm(start, end);
        if (directKm == 0) {
            return Optional.empty();
        }

        List<Coordinate> samples = new ArrayList<>();
        for (double offset : POI_OFFSETS) {
            for (int side : new int[]{1, -1}) {
                samples.add(new Coordinate(
                        clamp(mid.latitude() + side * (-dLon * offset), -90, 90),
                        clamp(mid.longitude() + side * (dLat * offset), -180, 180)));
            }
        }

        List<Integer> densities = BoundedFanOut.map(samples, properties.getScenic().getFanOutConcurrency(), p ->
                countryCode.equalsIgnoreCase(countryResolver.resolveCountry(p)) ? featureFinder.poiDensity(p) : 0);

        int bestIndex = -1;
        for (int i = 0; i < samples.size(); i++) {
            int density = densities.get(i);
            if (density <= MIN_POI_DENSITY || (bestIndex >= 0 && density <= densities.get(bestIndex))) {
                continue;
            }
            double detour = detourPercent(start, samples.get(i), end, directKm);
            if (detour > maxDetourPercent) {
                log.debug("POI sample {} (density {}) exceeds {}% detour: {}%",
                        samples.get(i), density, maxDetourPercent, Math.round(detour));
                continue;
            }
            bestIndex = i;
        }
        if (bestIndex < 0) {
            log.info("No POI-rich waypoint found, routing directly");
            return Optional.empty();
        }
        log.info("POI-rich waypoint {} with density {}", samples.get(bestIndex), densities.get(bestIndex));
        return Optional.of(samples.get(bestIndex));
    }

    static double detourPercent(Coordinate start, Coordinate via, Coordinate end, double directKm) {
        return (GeoUtils.haversineKm(start, via) + GeoUtils.haversineKm(via, end) - directKm) / directKm * 100;
    }

    public List<Coordinate> findPOIRichWaypoints(Coordinate start, Coordinate end, double maxDetourPercent) {
        return sharedCountry(start, end)
                .flatMap(country -> selectPOIRichWaypoint(start, end, country, maxDetourPercent))
                .map(List::of)
                .orElse(List.of());
    }

    private Optional<String> sharedCountry(Coordinate start, Coordinate end) {
        List<String> countries = BoundedFanOut.map(List.of(start, end), 2, countryResolver::resolveCountry);
        String startCountry = countries.get(0);
        String endCountry = countries.get(1);
        if (!CountryResolver.isKnown(startCountry) || !CountryResolver.isKnown(endCountry)) {
            log.info("Endpoint country unknown ({} / {}), no waypoints", startCountry, endCountry);
            return Optional.empty();
        }
        if (!startCountry.equals(endCountry)) {
            log.info("International route {} -> {}, no waypoints", startCountry, endCountry);
            return Optional.empty();
        }
        return Optional.of(startCountry);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
