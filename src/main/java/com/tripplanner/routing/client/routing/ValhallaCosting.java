package com.tripplanner.routing.client.routing;

import com.tripplanner.routing.model.StylePreference;
import com.tripplanner.routing.model.TransportProfile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Valhalla {@code costing_options} for the style preferences, tiered by direct trip distance.
 */
public final class ValhallaCosting {

    static final double SHORT_TRIP_KM = 50;
    static final double MEDIUM_TRIP_KM = 200;

    private static final int COUNTRY_CROSSING_COST = 600;

    private ValhallaCosting() {
    }

    public static int alternates(StylePreference preference) {
        if (preference == null) {
            return 0;
        }
        return switch (preference) {
            case SCENIC -> 3;
            case LONGEST -> 1;
            default -> 0;
        };
    }

    /**
     * Options for the profile's costing model, or an empty map when Valhalla's defaults apply.
     */
    public static Map<String, Object> options(TransportProfile profile, StylePreference preference,
                                              double directDistanceKm) {
        if (preference == null || preference == StylePreference.FASTEST) {
            return Map.of();
        }
        if (preference == StylePreference.SHORTEST) {
            return Map.of("shortest", true);
        }
        if (profile != TransportProfile.DRIVING) {
            return Map.of();
        }
        Tier tier = Tier.of(directDistanceKm);
        return preference == StylePreference.SCENIC ? scenic(tier) : longest(tier);
    }

    private static Map<String, Object> scenic(Tier tier) {
        return switch (tier) {
            case SHORT -> auto(0.0, 0.0, 0.0, 0.9, 3);
            case MEDIUM -> auto(0.2, 0.0, 0.0, 0.7, 5);
            case LONG -> auto(0.4, 0.1, 0.0, 0.6, 7);
        };
    }

    private static Map<String, Object> longest(Tier tier) {
        return switch (tier) {
            case SHORT -> auto(0.0, 0.0, 0.3, 1.0, 1);
            case MEDIUM -> auto(0.3, 0.2, 0.2, 0.8, 3);
            case LONG -> auto(0.5, 0.3, 0.1, 0.7, 5);
        };
    }

    private static Map<String, Object> auto(double highways, double tolls, double tracks,
                                            double livingStreets, int maneuverPenalty) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("use_highways", highways);
        options.put("use_tolls", tolls);
        options.put("use_ferry", 1.0);
        options.put("use_tracks", tracks);
        options.put("use_living_streets", livingStreets);
        options.put("maneuver_penalty", maneuverPenalty);
        options.put("shortest", false);
        options.put("country_crossing_cost", COUNTRY_CROSSING_COST);
        options.put("country_crossing_penalty", 0);
        return options;
    }

    enum Tier {
        SHORT, MEDIUM, LONG;

        static Tier of(double km) {
            if (km < SHORT_TRIP_KM) return SHORT;
            if (km < MEDIUM_TRIP_KM) return MEDIUM;
            return LONG;
        }
    }
}
