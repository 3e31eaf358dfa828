package com.tripplanner.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StylePreference {
    FASTEST,
    SHORTEST,
    SCENIC,
    LONGEST;

    /** Token used in cache keys and logs for an absent preference. */
    public static final String DEFAULT_TOKEN = "default";

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isDetourStyle() {
        return this == SCENIC || this == LONGEST;
    }

    public static String tokenOf(StylePreference preference) {
        return preference == null ? DEFAULT_TOKEN : preference.id();
    }

    @JsonCreator
    public static StylePreference fromId(String value) {
        if (value == null || value.isBlank() || DEFAULT_TOKEN.equalsIgnoreCase(value.trim())) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
