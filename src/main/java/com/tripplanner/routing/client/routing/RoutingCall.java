package com.tripplanner.routing.client.routing;

import com.tripplanner.routing.model.Coordinate;
import com.tripplanner.routing.model.StylePreference;
import com.tripplanner.routing.model.TransportProfile;
import com.tripplanner.routing.util.GeoUtils;

import java.util.List;

/**
 * Ordered stops (waypoints already inserted) plus routing options, as handed to every adapter.
 *
 * @param preference may be null for the default route
 */
public record RoutingCall(List<Coordinate> locations, TransportProfile profile, StylePreference preference) {

    public RoutingCall {
        locations = List.copyOf(locations);
        profile = profile == null ? TransportProfile.DRIVING : profile;
    }

    public Coordinate start() {
        return locations.get(0);
    }

    public Coordinate end() {
        return locations.get(locations.size() - 1);
    }

    public double directDistanceKm() {
        return GeoUtils.haversineKm(start(), end());
    }
}
