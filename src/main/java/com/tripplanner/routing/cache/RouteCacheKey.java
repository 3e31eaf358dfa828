package com.tripplanner.routing.cache;

import com.tripplanner.routing.model.Coordinate;
import com.tripplanner.routing.model.StylePreference;
import com.tripplanner.routing.model.TransportProfile;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * {@code profile:preference:lng,lat|lng,lat...}, coordinates at 4 decimals (about 11 m).
 */
public final class RouteCacheKey {

    private RouteCacheKey() {
    }

    public static String of(List<Coordinate> coordinates, TransportProfile profile, StylePreference preference) {
        String points = coordinates.stream()
                .map(c -> String.format(Locale.US, "%.4f,%.4f", c.longitude(), c.latitude()))
                .collect(Collectors.joining("|"));
        return profile.id() + ":" + StylePreference.tokenOf(preference) + ":" + points;
    }
}
