package com.tripplanner.routing.model.dto;

import com.tripplanner.routing.model.LineString;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "ScenicScoreRequest", description = "Geometry to rate by nearby scenic features")
public class ScenicScoreRequest {
    @NotNull
    private LineString geometry;
    @Schema(description = "Only count features in this country (ISO 3166-1)", example = "FR")
    private String countryCode;
}
