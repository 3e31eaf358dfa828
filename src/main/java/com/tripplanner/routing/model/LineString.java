package com.tripplanner.routing.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Compared by value: positions are copied in and out, equality is per coordinate bit pattern.
 */
@Schema(name = "LineString", description = "GeoJSON LineString, positions as [lng, lat]")
public record LineString(
        @Schema(example = "LineString")
        String type,
        @Schema(description = "Ordered [lng, lat] positions")
        List<double[]> coordinates
) {

    public static final String TYPE = "LineString";

    public LineString {
        type = TYPE;
        coordinates = coordinates == null ? List.of() : copy(coordinates);
    }

    public static LineString of(List<double[]> coordinates) {
        return new LineString(TYPE, coordinates);
    }

    @Override
    public List<double[]> coordinates() {
        return copy(coordinates);
    }

    public int size() {
        return coordinates.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LineString other = (LineString) o;
        if (coordinates.size() != other.coordinates.size()) {
            return false;
        }
        for (int i = 0; i < coordinates.size(); i++) {
            if (!Arrays.equals(coordinates.get(i), other.coordinates.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (double[] position : coordinates) {
            hash = 31 * hash + Arrays.hashCode(position);
        }
        return hash;
    }

    @Override
    public String toString() {
        return "LineString" + coordinates.stream().map(Arrays::toString).collect(Collectors.joining(", ", "[", "]"));
    }

    private static List<double[]> copy(List<double[]> positions) {
        List<double[]> result = new ArrayList<>(positions.size());
        for (double[] position : positions) {
            if (position == null) {
                throw new IllegalArgumentException("LineString position must not be null");
            }
            result.add(position.clone());
        }
        return Collections.unmodifiableList(result);
    }
}
