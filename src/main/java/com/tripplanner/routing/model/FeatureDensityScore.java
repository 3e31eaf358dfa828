package com.tripplanner.routing.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(name = "FeatureDensityScore", description = "Advisory scenic score of a route geometry")
public record FeatureDensityScore(
        @Schema(description = "Weighted score, higher is more scenic", example = "142.8")
        double score,
        @Schema(description = "Distinct features found along the route", example = "17")
        int featureCount,
        @Schema(description = "Feature count per type")
        Map<FeatureType, Integer> featureTypeCounts,
        @Schema(description = "Highest weighted features", example = "[\"Vanoise (national_park)\"]")
        List<String> topFeatures
) {

    public static FeatureDensityScore empty() {
        return new FeatureDensityScore(0, 0, Map.of(), List.of());
    }
}
