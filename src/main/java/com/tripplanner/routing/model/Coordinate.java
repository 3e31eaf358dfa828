package com.tripplanner.routing.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

@Schema(name = "Coordinate", description = "Geographic point (WGS84)")
public record Coordinate(
        @DecimalMin("-90.0") @DecimalMax("90.0")
        @Schema(description = "Latitude", example = "48.8566")
        double latitude,
        @DecimalMin("-180.0") @DecimalMax("180.0")
        @Schema(description = "Longitude", example = "2.3522")
        double longitude
) {

    /**
     * Builds a coordinate from a GeoJSON position ({@code [lng, lat]}).
     */
    public static Coordinate fromPosition(double[] position) {
        return new Coordinate(position[1], position[0]);
    }

    public double[] toPosition() {
        return new double[]{longitude, latitude};
    }
}
