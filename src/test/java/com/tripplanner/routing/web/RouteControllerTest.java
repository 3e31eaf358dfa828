package com.tripplanner.routing.web;

import com.tripplanner.routing.error.InvalidRouteRequestException;
import com.tripplanner.routing.error.RoutingUnavailableException;
import com.tripplanner.routing.model.FeatureDensityScore;
import com.tripplanner.routing.model.FeatureType;
import com.tripplanner.routing.model.LineString;
import com.tripplanner.routing.model.Provider;
import com.tripplanner.routing.model.RouteResult;
import com.tripplanner.routing.model.StylePreference;
import com.tripplanner.routing.model.TransportProfile;
import com.tripplanner.routing.model.dto.RouteSegment;
import com.tripplanner.routing.model.dto.SegmentLocation;
import com.tripplanner.routing.model.dto.UsageSummary;
import com.tripplanner.routing.service.ProviderQuotaService;
import com.tripplanner.routing.service.RoutePlanningService;
import com.tripplanner.routing.service.RouteSegmentationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RouteController.class)
class RouteControllerTest {

    private static final String PARIS_LYON = "[{\"latitude\":48.8566,\"longitude\":2.3522},"
            + "{\"latitude\":45.7640,\"longitude\":4.8357}]";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RoutePlanningService planningService;

    @MockBean
    private RouteSegmentationService segmentationService;

    @MockBean
    private ProviderQuotaService quotaService;

    // ===== POST /api/routes =====

    @Test
    void testGetRoute_Ok() throws Exception {
        when(planningService.getRoute(anyList(), eq(TransportProfile.DRIVING), eq(StylePreference.SCENIC), eq(false)))
                .thenReturn(route(Provider.STADIA));

        mockMvc.perform(post("/api/routes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coordinates\":" + PARIS_LYON + ",\"profile\":\"driving-car\",\"preference\":\"scenic\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.geometry.type").value("LineString"))
                .andExpect(jsonPath("$.geometry.coordinates.length()").value(2))
                .andExpect(jsonPath("$.distance").value(465000.0))
                .andExpect(jsonPath("$.provider").value("stadia"));
    }

    @Test
    void testGetRoute_DefaultsWhenOptionalFieldsMissing() throws Exception {
        when(planningService.getRoute(anyList(), any(), any(), anyBoolean())).thenReturn(route(Provider.OSRM));

        mockMvc.perform(post("/api/routes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coordinates\":" + PARIS_LYON + ",\"preference\":\"default\"}"))
                .andExpect(status().isOk());

        verify(planningService).getRoute(anyList(), eq(TransportProfile.DRIVING), isNull(), eq(false));
    }

    @Test
    @DisplayName("Single coordinate is rejected by validation")
    void testGetRoute_TooFewCoordinates() throws Exception {
        mockMvc.perform(post("/api/routes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coordinates\":[{\"latitude\":48.8566,\"longitude\":2.3522}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.violations[0].field").value("coordinates"));

        verifyNoInteractions(planningService);
    }

    @Test
    void testGetRoute_LatitudeOutOfRange() throws Exception {
        mockMvc.perform(post("/api/routes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coordinates\":[{\"latitude\":91,\"longitude\":2.35},{\"latitude\":45.76,\"longitude\":4.83}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testGetRoute_UnknownProfile() throws Exception {
        mockMvc.perform(post("/api/routes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coordinates\":" + PARIS_LYON + ",\"profile\":\"hovercraft\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void testGetRoute_ServiceRejection() throws Exception {
        when(planningService.getRoute(anyList(), any(), any(), anyBoolean()))
                .thenThrow(new InvalidRouteRequestException("Coordinate out of range"));

        mockMvc.perform(post("/api/routes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coordinates\":" + PARIS_LYON + "}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Coordinate out of range"));
    }

    @Test
    @DisplayName("All providers down maps to a retryable 503")
    void testGetRoute_AllProvidersDown() throws Exception {
        when(planningService.getRoute(anyList(), any(), any(), anyBoolean()))
                .thenThrow(new RoutingUnavailableException("No routing provider could compute the route",
                        List.of("stadia: HTTP 503", "osrm: HTTP 429")));

        mockMvc.perform(post("/api/routes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coordinates\":" + PARIS_LYON + "}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value(503))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    // ===== Other endpoints =====

    @Test
    void testBatch() throws Exception {
        when(planningService.getBatchRoutes(anyList(), eq(TransportProfile.WALKING)))
                .thenReturn(List.of(route(Provider.OSRM), route(Provider.CACHE)));

        mockMvc.perform(post("/api/routes/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"locations\":" + PARIS_LYON + ",\"profile\":\"walking\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].provider").value("cache"));
    }

    @Test
    void testSegments() throws Exception {
        SegmentLocation paris = new SegmentLocation("Paris", new double[]{2.3522, 48.8566});
        SegmentLocation stop = new SegmentLocation("Stop 1", new double[]{3.5, 47.0});
        RouteSegment day = RouteSegment.builder()
                .day(1)
                .startLocation(paris)
                .endLocation(stop)
                .geometry(List.of(new double[]{2.3522, 48.8566}, new double[]{3.5, 47.0}))
                .drivingTimeHours(5)
                .distanceKm(240)
                .estimatedDepartureTime(LocalDateTime.of(2025, 7, 1, 9, 0))
                .estimatedArrivalTime(LocalDateTime.of(2025, 7, 1, 14, 0))
                .build();
        when(segmentationService.segmentByDrivingTime(any())).thenReturn(List.of(day));
        when(segmentationService.calculateOvernightStops(anyList())).thenReturn(List.of());

        mockMvc.perform(post("/api/routes/segments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"routeGeometry\":[[2.3522,48.8566],[3.5,47.0]],\"totalDistanceKm\":240,"
                                + "\"totalDurationHours\":5,\"maxDrivingHoursPerDay\":6,\"startDate\":\"2025-07-01\","
                                + "\"locations\":[{\"name\":\"Paris\",\"coordinates\":[2.3522,48.8566]},"
                                + "{\"name\":\"Bourges\",\"coordinates\":[2.3984,47.0810]}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.segments[0].endLocation.name").value("Stop 1"))
                .andExpect(jsonPath("$.overnightStops.length()").value(0));
    }

    @Test
    void testSegments_NonPositiveCap() throws Exception {
        mockMvc.perform(post("/api/routes/segments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"routeGeometry\":[[2.3522,48.8566],[3.5,47.0]],\"totalDistanceKm\":240,"
                                + "\"totalDurationHours\":5,\"maxDrivingHoursPerDay\":0,\"startDate\":\"2025-07-01\","
                                + "\"locations\":[{\"name\":\"Paris\",\"coordinates\":[2.3522,48.8566]},"
                                + "{\"name\":\"Bourges\",\"coordinates\":[2.3984,47.0810]}]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(segmentationService);
    }

    @Test
    void testScenicScore() throws Exception {
        when(planningService.scoreRoute(any(), eq("FR"))).thenReturn(new FeatureDensityScore(
                54.0, 6, Map.of(FeatureType.NATIONAL_PARK, 1), List.of("Vanoise (national_park)")));

        mockMvc.perform(post("/api/routes/scenic-score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"geometry\":{\"type\":\"LineString\",\"coordinates\":[[5.9,45.5],[6.8,45.4]]},"
                                + "\"countryCode\":\"FR\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(54.0))
                .andExpect(jsonPath("$.topFeatures[0]").value("Vanoise (national_park)"));
    }

    @Test
    void testUsage() throws Exception {
        when(quotaService.summary()).thenReturn(UsageSummary.builder()
                .month("2025-06")
                .providers(List.of(UsageSummary.ProviderUsage.builder()
                        .provider("stadia").count(1234).quota(10_000L).remaining(8766L).build()))
                .build());
        when(planningService.cacheUsage()).thenReturn(UsageSummary.CacheUsage.builder()
                .entries(12).hits(30).misses(10).hitRate(0.75).build());

        mockMvc.perform(get("/api/routes/usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.month").value("2025-06"))
                .andExpect(jsonPath("$.providers[0].remaining").value(8766))
                .andExpect(jsonPath("$.fastCache.entries").value(12))
                .andExpect(jsonPath("$.fastCache.hitRate").value(0.75));
    }

    private static RouteResult route(Provider provider) {
        return new RouteResult(LineString.of(List.of(new double[]{2.3522, 48.8566}, new double[]{4.8357, 45.764})),
                465000, 16200, provider);
    }
}
