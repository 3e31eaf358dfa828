package com.tripplanner.routing.cache;

import com.tripplanner.routing.model.Coordinate;
import com.tripplanner.routing.model.StylePreference;
import com.tripplanner.routing.model.TransportProfile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteCacheKeyTest {

    @Test
    void testKeyFormat() {
        String key = RouteCacheKey.of(
                List.of(new Coordinate(48.856613, 2.352222), new Coordinate(41.902782, 12.496366)),
                TransportProfile.DRIVING, StylePreference.SCENIC);

        assertEquals("driving:scenic:2.3522,48.8566|12.4964,41.9028", key);
    }

    @Test
    void testKeyFormat_DefaultPreference() {
        String key = RouteCacheKey.of(
                List.of(new Coordinate(1, 2), new Coordinate(3, 4)), TransportProfile.CYCLING, null);

        assertEquals("cycling:default:2.0000,1.0000|4.0000,3.0000", key);
    }

    @Test
    void testNearbyPointsShareKey() {
        String a = RouteCacheKey.of(List.of(new Coordinate(45.00001, 7.00001), new Coordinate(46, 8)),
                TransportProfile.DRIVING, null);
        String b = RouteCacheKey.of(List.of(new Coordinate(45.00002, 7.00002), new Coordinate(46, 8)),
                TransportProfile.DRIVING, null);
        assertEquals(a, b);
    }
}
