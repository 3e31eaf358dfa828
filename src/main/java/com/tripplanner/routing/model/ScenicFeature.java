package com.tripplanner.routing.model;

/**
 * Classified POI candidate found near a route.
 *
 * @param source raw OSM tag value the feature was classified from
 */
public record ScenicFeature(FeatureType type, String name, Coordinate coordinate, String source) {

    public String label() {
        return name + " (" + type.id() + ")";
    }
}
