package com.tripplanner.routing.client.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripplanner.routing.error.DecodeException;
import com.tripplanner.routing.error.ProviderException;
import com.tripplanner.routing.model.LineString;
import com.tripplanner.routing.model.RouteResult;
import com.tripplanner.routing.model.external.valhalla.ValhallaRouteRequest;
import com.tripplanner.routing.model.external.valhalla.ValhallaRouteResponse;
import com.tripplanner.routing.util.PolylineCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Valhalla {@code /route} request building and response parsing, shared by the hosted and self-hosted instances.
 */
@Slf4j
public abstract class AbstractValhallaAdapter implements RoutingAdapter {

    private static final String UNITS = "kilometers";

    protected final WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    protected AbstractValhallaAdapter(WebClient webClient) {
        this.webClient = webClient;
    }

    protected abstract String routeUrl();

    protected abstract int timeoutMillis();

    protected void authorize(HttpHeaders headers) {
    }

    @Override
    public RouteResult route(RoutingCall call, Duration timeout) {
        ValhallaRouteRequest request = buildRequest(call);
        Duration effective = timeout.compareTo(Duration.ofMillis(timeoutMillis())) < 0
                ? timeout : Duration.ofMillis(timeoutMillis());

        String body;
        try {
            body = webClient.post()
                    .uri(routeUrl())
                    .headers(this::authorize)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(mapper.writeValueAsString(request))
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

    ValhallaRouteRequest buildRequest(RoutingCall call) {
        List<ValhallaRouteRequest.Location> locations = call.locations().stream()
                .map(c -> new ValhallaRouteRequest.Location(c.latitude(), c.longitude()))
                .toList();
        String costing = call.profile().valhallaCosting();
        Map<String, Object> options = ValhallaCosting.options(call.profile(), call.preference(), call.directDistanceKm());
        int alternates = ValhallaCosting.alternates(call.preference());

        return ValhallaRouteRequest.builder()
                .locations(locations)
                .costing(costing)
                .costingOptions(options.isEmpty() ? null : Map.of(costing, options))
                .alternates(alternates > 0 ? alternates : null)
                .units(UNITS)
                .build();
    }

    RouteResult parse(String body, RoutingCall call) {
        if (body == null || body.isBlank()) {
            throw new ProviderException(provider(), "empty response body");
        }
        ValhallaRouteResponse response;
        try {
            response = mapper.readValue(body, ValhallaRouteResponse.class);
        } catch (Exception e) {
            throw new ProviderException(provider(), "malformed response: " + e.getMessage(), e);
        }
        if (response.getTrip() == null) {
            throw new ProviderException(provider(), "response has no trip");
        }

        List<RouteResult> candidates = new ArrayList<>();
        candidates.add(toRoute(response.getTrip()));
        if (response.getAlternates() != null) {
            for (ValhallaRouteResponse.Alternate alternate : response.getAlternates()) {
                if (alternate.getTrip() != null) {
                    candidates.add(toRoute(alternate.getTrip()));
                }
            }
        }
        RouteResult selected = AlternativeSelector.select(candidates, call.preference());
        log.info("{} returned {} route(s), selected {} km for {}", provider().id(), candidates.size(),
                Math.round(selected.distance() / 1000), call.preference() == null ? "default" : call.preference().id());
        return selected;
    }

    private RouteResult toRoute(ValhallaRouteResponse.Trip trip) {
        if (trip.getLegs() == null || trip.getLegs().isEmpty()) {
            throw new ProviderException(provider(), "trip has no legs");
        }
        List<double[]> positions = new ArrayList<>();
        double legLengthKm = 0;
        double legTime = 0;
        for (ValhallaRouteResponse.Leg leg : trip.getLegs()) {
            List<double[]> decoded;
            try {
                decoded = PolylineCodec.decode(leg.getShape(), PolylineCodec.VALHALLA_PRECISION);
            } catch (DecodeException e) {
                throw new ProviderException(provider(), "undecodable leg shape: " + e.getMessage(), e);
            }
            if (!positions.isEmpty() && !decoded.isEmpty()
                    && Arrays.equals(positions.get(positions.size() - 1), decoded.get(0))) {
                decoded = decoded.subList(1, decoded.size());
            }
            positions.addAll(decoded);
            if (leg.getSummary() != null) {
                legLengthKm += nullToZero(leg.getSummary().getLength());
                legTime += nullToZero(leg.getSummary().getTime());
            }
        }
        if (positions.size() < 2) {
            throw new ProviderException(provider(), "trip geometry has fewer than 2 points");
        }

        ValhallaRouteResponse.Summary summary = trip.getSummary();
        double lengthKm = summary != null && summary.getLength() != null ? summary.getLength() : legLengthKm;
        double time = summary != null && summary.getTime() != null ? summary.getTime() : legTime;
        return new RouteResult(LineString.of(positions), lengthKm * 1000, time, provider());
    }

    private static double nullToZero(Double value) {
        return value == null ? 0 : value;
    }
}
