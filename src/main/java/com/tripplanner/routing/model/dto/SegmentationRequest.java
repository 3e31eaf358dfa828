package com.tripplanner.routing.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "SegmentationRequest", description = "Split a computed route into daily drives")
public class SegmentationRequest {
    @NotNull
    @Size(min = 2)
    @Schema(description = "Full route geometry, [lng, lat] positions")
    private List<double[]> routeGeometry;
    @PositiveOrZero
    @Schema(description = "Route distance (km)", example = "1420.5")
    private double totalDistanceKm;
    @PositiveOrZero
    @Schema(description = "Route duration (h)", example = "14.2")
    private double totalDurationHours;
    @Positive
    @Schema(description = "Driving cap per day (h)", example = "5")
    private double maxDrivingHoursPerDay;
    @NotNull
    @Schema(description = "First travel day", example = "2025-07-01")
    private LocalDate startDate;
    @Schema(description = "Departure on day 1, default 09:00", example = "09:00")
    private LocalTime startTime;
    @NotNull
    @Size(min = 2)
    @Valid
    @Schema(description = "Trip origin first, destination last")
    private List<SegmentLocation> locations;
}
