package com.tripplanner.routing.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RouteSegment", description = "One day of driving")
public class RouteSegment {
    @Schema(description = "Day number, starting at 1", example = "1")
    private int day;
    @Schema(description = "Where the day starts")
    private SegmentLocation startLocation;
    @Schema(description = "Where the day ends")
    private SegmentLocation endLocation;
    @Schema(description = "Slice of the route geometry, [lng, lat] positions")
    private List<double[]> geometry;
    @Schema(description = "Driving time (h)", example = "4.8")
    private double drivingTimeHours;
    @Schema(description = "Distance (km)", example = "412.5")
    private double distanceKm;
    @Schema(description = "Departure, local time", example = "2025-07-01T09:00:00")
    private LocalDateTime estimatedDepartureTime;
    @Schema(description = "Arrival, local time", example = "2025-07-01T13:48:00")
    private LocalDateTime estimatedArrivalTime;
}
