package com.tripplanner.routing.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FeatureType {
    CITY(8),
    TOWN(8),
    VIEWPOINT(7),
    ATTRACTION(9),
    NATIONAL_PARK(10),
    SKI_RESORT(6),
    LAKE(5),
    OTHER(0);

    private final int densityWeight;

    FeatureType(int densityWeight) {
        this.densityWeight = densityWeight;
    }

    /** Weight of one feature of this type in the route density score. */
    public int densityWeight() {
        return densityWeight;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
