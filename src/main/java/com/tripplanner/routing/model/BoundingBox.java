package com.tripplanner.routing.model;

public record BoundingBox(double minLatitude, double minLongitude, double maxLatitude, double maxLongitude) {
}
