package com.tripplanner.routing.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Computed road route. Immutable; cached by value.
 *
 * @param geometry line geometry, at least two positions
 * @param distance total distance in meters
 * @param duration total duration in seconds
 * @param provider backend or cache layer that produced the route
 */
@Schema(name = "RouteResult", description = "Road route with geometry, distance and duration")
public record RouteResult(
        LineString geometry,
        @Schema(description = "Distance in meters", example = "1420512.4")
        double distance,
        @Schema(description = "Duration in seconds", example = "50412.0")
        double duration,
        @Schema(description = "Backend that produced the route", example = "valhalla")
        Provider provider
) {

    public RouteResult {
        if (geometry == null || geometry.size() < 2) {
            throw new IllegalArgumentException("Route geometry needs at least 2 positions");
        }
        if (distance < 0 || duration < 0 || Double.isNaN(distance) || Double.isNaN(duration)) {
            throw new IllegalArgumentException("Route distance and duration must be non-negative");
        }
        if (provider == null) {
            throw new IllegalArgumentException("Route provider is required");
        }
    }
}
