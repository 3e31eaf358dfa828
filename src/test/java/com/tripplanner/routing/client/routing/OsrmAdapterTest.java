package com.tripplanner.routing.client.routing;

import com.tripplanner.routing.client.StubWebClients;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.error.ProviderException;
import com.tripplanner.routing.model.Coordinate;
import com.tripplanner.routing.model.Provider;
import com.tripplanner.routing.model.RouteResult;
import com.tripplanner.routing.model.StylePreference;
import com.tripplanner.routing.model.TransportProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OsrmAdapterTest {

    private static final Coordinate PARIS = new Coordinate(48.8566, 2.3522);
    private static final Coordinate LYON = new Coordinate(45.7640, 4.8357);

    // three alternatives: 470 km / 5 h, 520 km / 4.8 h, 610 km / 6 h
    private static final String THREE_ROUTES = """
            {"code":"Ok","routes":[
              {"distance":470000,"duration":18000,"geometry":{"type":"LineString","coordinates":[[2.3522,48.8566],[3.1,47.2],[4.8357,45.764]]}},
              {"distance":520000,"duration":17280,"geometry":{"type":"LineString","coordinates":[[2.3522,48.8566],[3.9,47.0],[4.8357,45.764]]}},
              {"distance":610000,"duration":21600,"geometry":{"type":"LineString","coordinates":[[2.3522,48.8566],[5.2,47.3],[4.8357,45.764]]}}
            ]}
            """;

    private final RoutingProperties properties = new RoutingProperties();

    @Test
    void testBuildUrl_DefaultRoute() {
        OsrmAdapter adapter = new OsrmAdapter(StubWebClients.json("{}").client(), properties);

        String url = adapter.buildUrl(new RoutingCall(List.of(PARIS, LYON), TransportProfile.DRIVING, null));

        assertEquals("https://router.project-osrm.org/route/v1/driving/2.352200,48.856600;4.835700,45.764000"
                + "?overview=full&geometries=geojson", url);
    }

    @Test
    void testBuildUrl_StyleAsksForAlternativesAndMapsProfile() {
        OsrmAdapter adapter = new OsrmAdapter(StubWebClients.json("{}").client(), properties);

        String url = adapter.buildUrl(new RoutingCall(List.of(PARIS, LYON), TransportProfile.WALKING, StylePreference.SHORTEST));

        assertTrue(url.contains("/route/v1/foot/"));
        assertTrue(url.endsWith("&alternatives=true"));
    }

    @ParameterizedTest
    @CsvSource({
            "SHORTEST, 470000",
            "FASTEST, 520000",
            "SCENIC, 520000",
            "LONGEST, 610000"
    })
    void testRoute_SelectsAlternativeByPreference(StylePreference preference, double expectedDistance) {
        StubWebClients.Recording stub = StubWebClients.json(THREE_ROUTES);
        OsrmAdapter adapter = new OsrmAdapter(stub.client(), properties);

        RouteResult result = adapter.route(new RoutingCall(List.of(PARIS, LYON), TransportProfile.DRIVING, preference),
                Duration.ofSeconds(5));

        assertEquals(expectedDistance, result.distance());
        assertEquals(Provider.OSRM, result.provider());
        assertEquals(HttpMethod.GET, stub.lastRequest().method());
    }

    @Test
    @DisplayName("Without a preference the first route is returned")
    void testRoute_DefaultTakesFirst() {
        OsrmAdapter adapter = new OsrmAdapter(StubWebClients.json(THREE_ROUTES).client(), properties);

        RouteResult result = adapter.route(new RoutingCall(List.of(PARIS, LYON), TransportProfile.DRIVING, null),
                Duration.ofSeconds(5));

        assertEquals(470000, result.distance());
        assertEquals(18000, result.duration());
        assertEquals(3, result.geometry().size());
        assertArrayEquals(new double[]{2.3522, 48.8566}, result.geometry().coordinates().get(0));
    }

    @Test
    void testRoute_NonOkCodeFails() {
        OsrmAdapter adapter = new OsrmAdapter(
                StubWebClients.json("{\"code\":\"NoRoute\",\"message\":\"Impossible route\"}").client(), properties);

        ProviderException e = assertThrows(ProviderException.class, () -> adapter.route(
                new RoutingCall(List.of(PARIS, LYON), TransportProfile.DRIVING, null), Duration.ofSeconds(5)));
        assertEquals(Provider.OSRM, e.getProvider());
        assertTrue(e.getMessage().contains("NoRoute"));
    }

    @Test
    void testRoute_EmptyRoutesFails() {
        OsrmAdapter adapter = new OsrmAdapter(StubWebClients.json("{\"code\":\"Ok\",\"routes\":[]}").client(), properties);

        assertThrows(ProviderException.class, () -> adapter.route(
                new RoutingCall(List.of(PARIS, LYON), TransportProfile.DRIVING, null), Duration.ofSeconds(5)));
    }

    @Test
    void testRoute_HttpErrorFails() {
        OsrmAdapter adapter = new OsrmAdapter(StubWebClients.status(HttpStatus.TOO_MANY_REQUESTS).client(), properties);

        ProviderException e = assertThrows(ProviderException.class, () -> adapter.route(
                new RoutingCall(List.of(PARIS, LYON), TransportProfile.DRIVING, null), Duration.ofSeconds(5)));
        assertTrue(e.getMessage().contains("429"));
    }

    @Test
    void testRoute_MalformedBodyFails() {
        OsrmAdapter adapter = new OsrmAdapter(StubWebClients.json("<html>").client(), properties);

        assertThrows(ProviderException.class, () -> adapter.route(
                new RoutingCall(List.of(PARIS, LYON), TransportProfile.DRIVING, null), Duration.ofSeconds(5)));
    }

    @Test
    void testRoute_TimeoutFails() {
        OsrmAdapter adapter = new OsrmAdapter(StubWebClients.hanging().client(), properties);

        assertThrows(ProviderException.class, () -> adapter.route(
                new RoutingCall(List.of(PARIS, LYON), TransportProfile.DRIVING, null), Duration.ofMillis(100)));
    }
}
