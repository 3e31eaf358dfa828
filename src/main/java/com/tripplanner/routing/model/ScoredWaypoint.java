package com.tripplanner.routing.model;

public record ScoredWaypoint(
        ScenicFeature feature,
        double score,
        double distanceFromRouteKm,
        double distanceFromStartKm
) {
}
