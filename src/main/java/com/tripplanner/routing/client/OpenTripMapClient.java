package com.tripplanner.routing.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.Coordinate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.OptionalInt;

@Slf4j
@Component
@RequiredArgsConstructor
public class OpenTripMapClient {

    private static final String RADIUS_ENDPOINT = "/places/radius";
    private static final String KINDS = "interesting_places,tourist_facilities,cultural,natural";
    private static final int LIMIT = 100;

    private final WebClient webClient;
    private final RoutingProperties properties;
    private final ObjectMapper mapper = new ObjectMapper();

    public boolean isConfigured() {
        return properties.getOpenTripMap().hasKey();
    }

    /**
     * Number of POIs (capped at 100) within the configured radius, empty when the lookup fails.
     */
    public OptionalInt countPlaces(Coordinate point) {
        if (!isConfigured()) {
            return OptionalInt.empty();
        }
        RoutingProperties.OpenTripMap config = properties.getOpenTripMap();
        String url = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path(RADIUS_ENDPOINT)
                .queryParam("radius", config.getRadiusMeters())
                .queryParam("lon", point.longitude())
                .queryParam("lat", point.latitude())
                .queryParam("kinds", KINDS)
                .queryParam("limit", LIMIT)
                .queryParam("apikey", config.getKey())
                .build()
                .toUriString();
        try {
            String body = webClient.get()
                    .uri(url)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(config.getTimeout()))
                    .block();
            if (body == null || body.isBlank()) {
                return OptionalInt.empty();
            }
            JsonNode root = mapper.readTree(body);
            if (root.isArray()) {
                return OptionalInt.of(root.size());
            }
            // geojson format wraps places in "features"
            JsonNode features = root.path("features");
            return features.isArray() ? OptionalInt.of(features.size()) : OptionalInt.empty();
        } catch (Exception e) {
            log.warn("OpenTripMap lookup failed at {}: {}", point, e.getMessage());
            return OptionalInt.empty();
        }
    }
}
