package com.tripplanner.routing.util;

import com.tripplanner.routing.model.BoundingBox;
import com.tripplanner.routing.model.Coordinate;

import java.util.List;

public final class GeoUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;
    private static final double KM_PER_DEGREE = 111.0;

    private GeoUtils() {
    }

    /**
     * Great-circle distance in kilometers.
     */
    public static double haversineKm(Coordinate a, Coordinate b) {
        return haversineKm(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    /**
     * Envelope of the given points padded by {@code marginKm} on every side.
     */
    public static BoundingBox boundingBox(List<Coordinate> coordinates, double marginKm) {
        if (coordinates == null || coordinates.isEmpty()) {
            throw new IllegalArgumentException("Bounding box needs at least one coordinate");
        }
        double minLat = Double.POSITIVE_INFINITY;
        double minLon = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;
        for (Coordinate c : coordinates) {
            minLat = Math.min(minLat, c.latitude());
            maxLat = Math.max(maxLat, c.latitude());
            minLon = Math.min(minLon, c.longitude());
            maxLon = Math.max(maxLon, c.longitude());
        }
        if (marginKm <= 0) {
            return new BoundingBox(minLat, minLon, maxLat, maxLon);
        }
        double latPad = marginKm / KM_PER_DEGREE;
        double midLat = Math.toRadians((minLat + maxLat) / 2);
        double lonPad = marginKm / (KM_PER_DEGREE * Math.max(Math.cos(midLat), 0.01));
        return new BoundingBox(
                Math.max(-90, minLat - latPad),
                Math.max(-180, minLon - lonPad),
                Math.min(90, maxLat + latPad),
                Math.min(180, maxLon + lonPad));
    }

    /**
     * Running distance in km at each vertex of a [lng, lat] line. First element is 0.
     */
    public static double[] cumulativeDistancesKm(List<double[]> positions) {
        double[] result = new double[positions.size()];
        for (int i = 1; i < positions.size(); i++) {
            double[] prev = positions.get(i - 1);
            double[] cur = positions.get(i);
            result[i] = result[i - 1] + haversineKm(prev[1], prev[0], cur[1], cur[0]);
        }
        return result;
    }

    /**
     * Distance in km of {@code point} from the straight start-end line, on an equirectangular projection.
     */
    public static double perpendicularDistanceKm(Coordinate point, Coordinate start, Coordinate end) {
        double cosLat = Math.cos(Math.toRadians((start.latitude() + end.latitude()) / 2));
        double x1 = start.longitude() * cosLat;
        double y1 = start.latitude();
        double x2 = end.longitude() * cosLat;
        double y2 = end.latitude();
        double px = point.longitude() * cosLat;
        double py = point.latitude();

        double dx = x2 - x1;
        double dy = y2 - y1;
        double lengthSq = dx * dx + dy * dy;
        if (lengthSq == 0) {
            return haversineKm(point, start);
        }
        double cross = Math.abs(dy * px - dx * py + x2 * y1 - y2 * x1);
        return cross / Math.sqrt(lengthSq) * KM_PER_DEGREE;
    }

    public static Coordinate midpoint(Coordinate a, Coordinate b) {
        return interpolate(a, b, 0.5);
    }

    public static Coordinate interpolate(Coordinate a, Coordinate b, double fraction) {
        return new Coordinate(
                a.latitude() + (b.latitude() - a.latitude()) * fraction,
                a.longitude() + (b.longitude() - a.longitude()) * fraction);
    }

    /**
     * Shifts a point sideways (perpendicular to the a-b direction) by {@code offsetKm}.
     * Positive offsets go to the left of the direction of travel.
     */
    public static Coordinate lateralOffset(Coordinate point, Coordinate a, Coordinate b, double offsetKm) {
        if (offsetKm == 0) {
            return point;
        }
        double cosLat = Math.max(Math.cos(Math.toRadians(point.latitude())), 0.01);
        double dx = (b.longitude() - a.longitude()) * cosLat;
        double dy = b.latitude() - a.latitude();
        double length = Math.sqrt(dx * dx + dy * dy);
        if (length == 0) {
            return point;
        }
        double offsetDeg = offsetKm / KM_PER_DEGREE;
        double lat = point.latitude() + (dx / length) * offsetDeg;
        double lon = point.longitude() - (dy / length) * offsetDeg / cosLat;
        return new Coordinate(clamp(lat, -90, 90), clamp(lon, -180, 180));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
