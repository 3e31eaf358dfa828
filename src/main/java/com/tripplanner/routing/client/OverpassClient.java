package com.tripplanner.routing.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.Coordinate;
import com.tripplanner.routing.model.external.overpass.OverpassResponse;
import com.tripplanner.routing.util.SlidingWindowRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Overpass interpreter access. Lookups never throw: any failure degrades to an empty result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OverpassClient {

    private static final String BOUNDARY_QUERY =
            "[out:json][timeout:5];is_in(%f,%f)->.a;area.a[\"ISO3166-1\"][\"admin_level\"=\"2\"];out tags;";

    private static final String FEATURE_QUERY = String.join("\n",
            "[out:json][timeout:10];",
            "(",
            "  node[\"place\"~\"^(town|city)$\"][\"name\"](around:%1$d,%2$f,%3$f);",
            "  node[\"tourism\"=\"attraction\"][\"name\"](around:%1$d,%2$f,%3$f);",
            "  node[\"tourism\"=\"viewpoint\"][\"name\"](around:%1$d,%2$f,%3$f);",
            "  node[\"boundary\"=\"national_park\"][\"name\"](around:%1$d,%2$f,%3$f);",
            "  way[\"boundary\"=\"national_park\"][\"name\"](around:%1$d,%2$f,%3$f);",
            "  node[\"sport\"=\"skiing\"][\"name\"](around:%1$d,%2$f,%3$f);",
            "  way[\"sport\"=\"skiing\"][\"name\"](around:%1$d,%2$f,%3$f);",
            "  node[\"natural\"=\"water\"][\"name\"](around:%1$d,%2$f,%3$f);",
            "  way[\"natural\"=\"water\"][\"name\"](around:%1$d,%2$f,%3$f);",
            ");",
            "out center;");

    private final WebClient webClient;
    private final RoutingProperties properties;
    private final SlidingWindowRateLimiter overpassRateLimiter;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * ISO 3166-1 code of the country containing the point, upper-cased.
     */
    public Optional<String> countryAt(Coordinate point) {
        if (!overpassRateLimiter.tryAcquire()) {
            log.warn("Overpass rate limit reached, skipping boundary lookup for {}", point);
            return Optional.empty();
        }
        String query = String.format(Locale.US, BOUNDARY_QUERY, point.latitude(), point.longitude());
        try {
            String body = post(query, properties.getOverpass().getBoundaryTimeout());
            if (body == null || body.isBlank()) {
                return Optional.empty();
            }
            JsonNode elements = mapper.readTree(body).path("elements");
            if (!elements.isArray()) {
                return Optional.empty();
            }
            for (JsonNode element : elements) {
                String iso = element.path("tags").path("ISO3166-1").asText("");
                if (!iso.isBlank()) {
                    return Optional.of(iso.trim().toUpperCase(Locale.ROOT));
                }
            }
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Boundary lookup failed for {}: {}", point, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Named scenic candidates (places, tourism, parks, ski areas, water) around a point.
     */
    public List<OverpassResponse.Element> featuresAround(Coordinate point, int radiusMeters) {
        if (!overpassRateLimiter.tryAcquire()) {
            log.warn("Overpass rate limit reached, skipping feature lookup around {}", point);
            return Collections.emptyList();
        }
        String query = String.format(Locale.US, FEATURE_QUERY, radiusMeters, point.latitude(), point.longitude());
        try {
            String body = post(query, properties.getOverpass().getTimeout());
            if (body == null || body.isBlank()) {
                log.warn("Overpass returned empty body for features around {}", point);
                return Collections.emptyList();
            }
            OverpassResponse response = mapper.readValue(body, OverpassResponse.class);
            List<OverpassResponse.Element> elements = response.getElements();
            log.debug("Overpass returned {} elements around {}", elements == null ? 0 : elements.size(), point);
            return elements == null ? Collections.emptyList() : elements;
        } catch (Exception e) {
            log.warn("Feature lookup failed around {}: {}", point, e.getMessage());
            return Collections.emptyList();
        }
    }

    private String post(String query, int timeoutMillis) {
        return webClient.post()
                .uri(properties.getOverpass().getUrl())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData("data", query))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(timeoutMillis))
                .block();
    }
}
