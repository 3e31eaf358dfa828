package com.tripplanner.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Backend (or cache layer) that produced a {@link RouteResult}.
 */
public enum Provider {
    /** Hosted Valhalla (Stadia Maps), metered per month. */
    STADIA("stadia"),
    /** Self-hosted Valhalla instance. */
    VALHALLA("valhalla"),
    /** Public OSRM server, no API key. */
    OSRM("osrm"),
    /** Served from the persistent cache layer, which does not keep provenance. */
    CACHE("cache");

    private final String id;

    Provider(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static Provider fromId(String value) {
        return Arrays.stream(values())
                .filter(p -> p.id.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + value));
    }
}
