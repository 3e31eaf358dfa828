package com.tripplanner.routing.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "SegmentLocation", description = "Named point of a multi-day trip")
public class SegmentLocation {
    @Schema(description = "Display name", example = "Paris")
    private String name;
    @NotNull
    @Size(min = 2, max = 2)
    @Schema(description = "[lng, lat]", example = "[2.3522, 48.8566]")
    private double[] coordinates;
}
