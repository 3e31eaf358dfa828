package com.tripplanner.routing.service;

import com.tripplanner.routing.client.OpenTripMapClient;
import com.tripplanner.routing.client.OverpassClient;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.Coordinate;
import com.tripplanner.routing.model.FeatureDensityScore;
import com.tripplanner.routing.model.FeatureType;
import com.tripplanner.routing.model.LineString;
import com.tripplanner.routing.model.ScenicFeature;
import com.tripplanner.routing.model.external.overpass.OverpassResponse;
import com.tripplanner.routing.util.BoundedFanOut;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scenic feature lookup and feature-density scoring of route geometries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScenicFeatureFinder {

    static final double DENSITY_RADIUS_KM = 10;
    static final int DENSITY_SAMPLES = 10;
    static final int DIVERSITY_THRESHOLD = 5;
    static final double DIVERSITY_BONUS = 1.2;
    static final int TOP_FEATURES = 5;

    private final OverpassClient overpassClient;
    private final OpenTripMapClient openTripMapClient;
    private final CountryResolver countryResolver;
    private final RoutingProperties properties;

    /**
     * Named scenic features within {@code radiusKm}. With a country code, features outside that country are dropped.
     * Returns an empty list when the lookup fails.
     */
    public List<ScenicFeature> findFeaturesNear(Coordinate point, String countryCode, double radiusKm) {
        List<OverpassResponse.Element> elements = overpassClient.featuresAround(point, (int) Math.round(radiusKm * 1000));
        List<ScenicFeature> features = elements.stream()
                .map(ScenicFeatureFinder::toFeature)
                .filter(Objects::nonNull)
                .toList();

        if (countryCode == null) {
            return features;
        }
        return keepInCountry(features, countryCode);
    }

    /**
     * Drops features outside {@code countryCode}. Boundary lookups run in one bounded batch.
     */
    public List<ScenicFeature> keepInCountry(List<ScenicFeature> features, String countryCode) {
        if (features.isEmpty()) {
            return features;
        }
        List<String> countries = BoundedFanOut.map(features, concurrency(),
                f -> countryResolver.resolveCountry(f.coordinate()));
        List<ScenicFeature> inCountry = new ArrayList<>();
        for (int i = 0; i < features.size(); i++) {
            if (countryCode.equalsIgnoreCase(countries.get(i))) {
                inCountry.add(features.get(i));
            }
        }
        if (inCountry.size() < features.size()) {
            log.debug("Dropped {} of {} features outside {}",
                    features.size() - inCountry.size(), features.size(), countryCode);
        }
        return inCountry;
    }

    /**
     * Samples about ten vertices of the geometry and scores the distinct features found around them.
     */
    public FeatureDensityScore scoreRouteByFeatureDensity(LineString geometry, String countryCode) {
        List<double[]> positions = geometry.coordinates();
        if (positions.isEmpty()) {
            return FeatureDensityScore.empty();
        }
        int step = Math.max(1, positions.size() / DENSITY_SAMPLES);
        List<Coordinate> samples = new ArrayList<>();
        for (int i = 0; i < positions.size(); i += step) {
            samples.add(Coordinate.fromPosition(positions.get(i)));
        }

        List<List<ScenicFeature>> perSample = BoundedFanOut.map(samples, concurrency(),
                p -> findFeaturesNear(p, null, DENSITY_RADIUS_KM));

        Map<String, ScenicFeature> unique = new LinkedHashMap<>();
        perSample.forEach(list -> list.forEach(f -> unique.putIfAbsent(f.name(), f)));
        List<ScenicFeature> features = new ArrayList<>(unique.values());
        if (countryCode != null) {
            features = keepInCountry(features, countryCode);
        }

        Map<FeatureType, Integer> typeCounts = new EnumMap<>(FeatureType.class);
        double score = 0;
        for (ScenicFeature feature : features) {
            typeCounts.merge(feature.type(), 1, Integer::sum);
            score += feature.type().densityWeight();
        }
        if (typeCounts.size() >= DIVERSITY_THRESHOLD) {
            score *= DIVERSITY_BONUS;
        }

        List<String> top = features.stream()
                .sorted(Comparator.comparingInt((ScenicFeature f) -> f.type().densityWeight()).reversed())
                .limit(TOP_FEATURES)
                .map(ScenicFeature::label)
                .toList();

        log.info("Feature density: {} samples, {} features, score {}", samples.size(), features.size(), score);
        return new FeatureDensityScore(score, features.size(), typeCounts, top);
    }

    /**
     * Number of points of interest within 10 km. Zero when nothing can be looked up.
     */
    public int poiDensity(Coordinate point) {
        try {
            if (openTripMapClient.isConfigured()) {
                return openTripMapClient.countPlaces(point).orElse(0);
            }
            return findFeaturesNear(point, null, DENSITY_RADIUS_KM).size();
        } catch (Exception e) {
            log.warn("POI density lookup failed at {}: {}", point, e.getMessage());
            return 0;
        }
    }

    static ScenicFeature toFeature(OverpassResponse.Element element) {
        String name = element.tag("name");
        Double lat = element.latitude();
        Double lon = element.longitude();
        if (name == null || name.isBlank() || lat == null || lon == null) {
            return null;
        }
        Classification c = classify(element);
        return new ScenicFeature(c.type(), name, new Coordinate(lat, lon), c.source());
    }

    static Classification classify(OverpassResponse.Element element) {
        String place = element.tag("place");
        if ("city".equals(place)) return new Classification(FeatureType.CITY, place);
        if ("town".equals(place)) return new Classification(FeatureType.TOWN, place);

        String tourism = element.tag("tourism");
        if ("viewpoint".equals(tourism)) return new Classification(FeatureType.VIEWPOINT, tourism);
        if ("attraction".equals(tourism)) return new Classification(FeatureType.ATTRACTION, tourism);

        if ("national_park".equals(element.tag("boundary"))) {
            return new Classification(FeatureType.NATIONAL_PARK, "national_park");
        }
        if ("skiing".equals(element.tag("sport"))) {
            return new Classification(FeatureType.SKI_RESORT, "skiing");
        }
        if ("water".equals(element.tag("natural"))) {
            return new Classification(FeatureType.LAKE, "water");
        }
        return new Classification(FeatureType.OTHER, firstTagValue(element));
    }

    private static String firstTagValue(OverpassResponse.Element element) {
        if (element.getTags() == null) {
            return "unknown";
        }
        return element.getTags().entrySet().stream()
                .filter(e -> !"name".equals(e.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse("unknown");
    }

    private int concurrency() {
        return properties.getScenic().getFanOutConcurrency();
    }

    record Classification(FeatureType type, String source) {
    }
}
