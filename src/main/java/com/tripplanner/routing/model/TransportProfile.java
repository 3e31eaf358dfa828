package com.tripplanner.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum TransportProfile {
    DRIVING("driving", "driving-car", "driving", "auto"),
    CYCLING("cycling", "cycling-regular", "cycling", "bicycle"),
    WALKING("walking", "foot-walking", "foot", "pedestrian"),
    WHEELCHAIR("wheelchair", "wheelchair", "foot", "pedestrian");

    private final String id;
    private final String legacyId;
    private final String osrmProfile;
    private final String valhallaCosting;

    TransportProfile(String id, String legacyId, String osrmProfile, String valhallaCosting) {
        this.id = id;
        this.legacyId = legacyId;
        this.osrmProfile = osrmProfile;
        this.valhallaCosting = valhallaCosting;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String osrmProfile() {
        return osrmProfile;
    }

    public String valhallaCosting() {
        return valhallaCosting;
    }

    @JsonCreator
    public static TransportProfile fromId(String value) {
        if (value == null || value.isBlank()) {
            return DRIVING;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.id.equals(normalized) || p.legacyId.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transport profile: " + value));
    }
}
