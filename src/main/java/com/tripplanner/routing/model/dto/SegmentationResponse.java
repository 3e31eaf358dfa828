package com.tripplanner.routing.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "SegmentationResponse")
public class SegmentationResponse {
    private List<RouteSegment> segments;
    private List<OvernightStop> overnightStops;
}
