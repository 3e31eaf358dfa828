package com.tripplanner.routing.client.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.error.ProviderException;
import com.tripplanner.routing.model.LineString;
import com.tripplanner.routing.model.Provider;
import com.tripplanner.routing.model.RouteResult;
import com.tripplanner.routing.model.external.osrm.OsrmRouteResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Public OSRM demo server. No key, no quota; the last resort of every chain.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OsrmAdapter implements RoutingAdapter {

    private static final String OK = "Ok";

    private final WebClient webClient;
    private final RoutingProperties properties;
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public Provider provider() {
        return Provider.OSRM;
    }

    @Override
    public RouteResult route(RoutingCall call, Duration timeout) {
        String url = buildUrl(call);
        Duration configured = Duration.ofMillis(properties.getOsrm().getTimeout());
        Duration effective = timeout.compareTo(configured) < 0 ? timeout : configured;

        String body;
        try {
            body = webClient.get()
                    .uri(url)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(effective)
                    .block();
        } catch (WebClientResponseException e) {
            throw new ProviderException(provider(), "HTTP " + e.getStatusCode().value(), e);
        } catch (Exception e) {
            throw new ProviderException(provider(), "request failed: " + e.getMessage(), e);
        }
        return parse(body, call);
    }

    String buildUrl(RoutingCall call) {
        String coordinates = call.locations().stream()
                .map(c -> String.format(Locale.US, "%.6f,%.6f", c.longitude(), c.latitude()))
                .collect(Collectors.joining(";"));
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getOsrm().getBaseUrl())
                .path("/route/v1/{profile}/{coordinates}")
                .queryParam("overview", "full")
                .queryParam("geometries", "geojson");
        if (call.preference() != null) {
            builder.queryParam("alternatives", "true");
        }
        return builder.buildAndExpand(call.profile().osrmProfile(), coordinates).toUriString();
    }

    RouteResult parse(String body, RoutingCall call) {
        if (body == null || body.isBlank()) {
            throw new ProviderException(provider(), "empty response body");
        }
        OsrmRouteResponse response;
        try {
            response = mapper.readValue(body, OsrmRouteResponse.class);
        } catch (Exception e) {
            throw new ProviderException(provider(), "malformed response: " + e.getMessage(), e);
        }
        if (!OK.equals(response.getCode())) {
            throw new ProviderException(provider(), "code " + response.getCode()
                    + (response.getMessage() != null ? " (" + response.getMessage() + ")" : ""));
        }
        if (response.getRoutes() == null || response.getRoutes().isEmpty()) {
            throw new ProviderException(provider(), "no routes in response");
        }

        List<RouteResult> candidates = new ArrayList<>();
        for (OsrmRouteResponse.Route route : response.getRoutes()) {
            if (route.getGeometry() == null || route.getGeometry().getCoordinates() == null
                    || route.getGeometry().getCoordinates().size() < 2) {
                continue;
            }
            double distance = route.getDistance() == null ? 0 : route.getDistance();
            double duration = route.getDuration() == null ? 0 : route.getDuration();
            candidates.add(new RouteResult(LineString.of(route.getGeometry().getCoordinates()),
                    distance, duration, provider()));
        }
        if (candidates.isEmpty()) {
            throw new ProviderException(provider(), "no route with usable geometry");
        }
        RouteResult selected = AlternativeSelector.select(candidates, call.preference());
        log.info("osrm returned {} route(s), selected {} km", candidates.size(), Math.round(selected.distance() / 1000));
        return selected;
    }
}
