package com.tripplanner.routing.web;

import com.tripplanner.routing.model.FeatureDensityScore;
import com.tripplanner.routing.model.RouteResult;
import com.tripplanner.routing.model.dto.BatchRouteRequest;
import com.tripplanner.routing.model.dto.RouteRequest;
import com.tripplanner.routing.model.dto.RouteSegment;
import com.tripplanner.routing.model.dto.ScenicScoreRequest;
import com.tripplanner.routing.model.dto.SegmentationRequest;
import com.tripplanner.routing.model.dto.SegmentationResponse;
import com.tripplanner.routing.model.dto.UsageSummary;
import com.tripplanner.routing.service.ProviderQuotaService;
import com.tripplanner.routing.service.RoutePlanningService;
import com.tripplanner.routing.service.RouteSegmentationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/routes")
@Tag(name = "Routes")
public class RouteController {

    private final RoutePlanningService planningService;
    private final RouteSegmentationService segmentationService;
    private final ProviderQuotaService quotaService;

    public RouteController(RoutePlanningService planningService,
                           RouteSegmentationService segmentationService,
                           ProviderQuotaService quotaService) {
        this.planningService = planningService;
        this.segmentationService = segmentationService;
        this.quotaService = quotaService;
    }

    @PostMapping
    @Operation(
            summary = "Compute a road route",
            description = "Routes through the given points. Scenic and longest styles may add waypoints in the start country"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Route computed",
                    content = @Content(schema = @Schema(implementation = RouteResult.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "503", description = "All routing providers failed")
    })
    public ResponseEntity<RouteResult> getRoute(
            @Valid @RequestBody
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "Route parameters",
                    required = true,
                    content = @Content(
                            schema = @Schema(implementation = RouteRequest.class),
                            examples = {
                                    @ExampleObject(name = "Paris to Lyon, scenic",
                                            value = "{\n  \"coordinates\": [\n    { \"latitude\": 48.8566, \"longitude\": 2.3522 },\n    { \"latitude\": 45.7640, \"longitude\": 4.8357 }\n  ],\n  \"profile\": \"driving\",\n  \"preference\": \"scenic\"\n}")
                            }
                    )
            ) RouteRequest request) {
        return ResponseEntity.ok(planningService.getRoute(
                request.getCoordinates(), request.getProfile(), request.getPreference(), request.isBustCache()));
    }

    @PostMapping("/batch")
    @Operation(summary = "Route consecutive legs", description = "One default route per consecutive pair of locations")
    public ResponseEntity<List<RouteResult>> getBatchRoutes(@Valid @RequestBody BatchRouteRequest request) {
        return ResponseEntity.ok(planningService.getBatchRoutes(request.getLocations(), request.getProfile()));
    }

    @PostMapping("/segments")
    @Operation(summary = "Split a route into days", description = "Daily drives capped by driving hours, with overnight stops")
    public ResponseEntity<SegmentationResponse> segment(@Valid @RequestBody SegmentationRequest request) {
        List<RouteSegment> segments = segmentationService.segmentByDrivingTime(request);
        return ResponseEntity.ok(SegmentationResponse.builder()
                .segments(segments)
                .overnightStops(segmentationService.calculateOvernightStops(segments))
                .build());
    }

    @PostMapping("/scenic-score")
    @Operation(summary = "Rate a geometry by scenic features", description = "Samples the line and weights nearby features")
    public ResponseEntity<FeatureDensityScore> scenicScore(@Valid @RequestBody ScenicScoreRequest request) {
        return ResponseEntity.ok(planningService.scoreRoute(request.getGeometry(), request.getCountryCode()));
    }

    @GetMapping("/usage")
    @Operation(summary = "Provider usage this month and route cache counters")
    public ResponseEntity<UsageSummary> usage() {
        UsageSummary summary = quotaService.summary();
        summary.setFastCache(planningService.cacheUsage());
        return ResponseEntity.ok(summary);
    }
}
