package com.tripplanner.routing.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "OvernightStop", description = "Night spent between two driving days")
public class OvernightStop {
    public static final String ONE_NIGHT = "1 night";

    private SegmentLocation location;
    @Schema(description = "Day the stop is reached", example = "1")
    private int day;
    private LocalDateTime arrivalTime;
    private LocalDateTime departureTime;
    @Schema(example = ONE_NIGHT)
    private String stayDuration;
}
