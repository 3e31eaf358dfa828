package com.tripplanner.routing.util;

import com.tripplanner.routing.error.DecodeException;

import java.util.ArrayList;
import java.util.List;

/**
 * Encoded polyline format (signed varint, delta-encoded, base64-like alphabet starting at '?').
 * Positions are {@code [lng, lat]}. Precision is the number of decimal digits kept:
 * 5 for Google/OSRM polylines, 6 for Valhalla.
 */
public final class PolylineCodec {

    public static final int VALHALLA_PRECISION = 6;

    private static final int MIN_CHAR = 63;
    private static final int MAX_CHAR = 126;
    private static final int MAX_SHIFT = 30;

    private PolylineCodec() {
    }

    public static List<double[]> decode(String encoded, int precision) {
        checkPrecision(precision);
        List<double[]> positions = new ArrayList<>();
        if (encoded == null || encoded.isEmpty()) {
            return positions;
        }
        double factor = Math.pow(10, precision);
        int index = 0;
        long lat = 0;
        long lng = 0;
        int length = encoded.length();

        while (index < length) {
            long[] latDelta = readVarint(encoded, index);
            index = (int) latDelta[1];
            if (index >= length) {
                throw new DecodeException("Polyline truncated after latitude at offset " + index);
            }
            long[] lngDelta = readVarint(encoded, index);
            index = (int) lngDelta[1];

            lat += latDelta[0];
            lng += lngDelta[0];
            positions.add(new double[]{lng / factor, lat / factor});
        }
        return positions;
    }

    public static String encode(List<double[]> positions, int precision) {
        checkPrecision(precision);
        StringBuilder out = new StringBuilder();
        if (positions == null) {
            return "";
        }
        double factor = Math.pow(10, precision);
        long prevLat = 0;
        long prevLng = 0;
        for (double[] position : positions) {
            long lat = Math.round(position[1] * factor);
            long lng = Math.round(position[0] * factor);
            writeVarint(lat - prevLat, out);
            writeVarint(lng - prevLng, out);
            prevLat = lat;
            prevLng = lng;
        }
        return out.toString();
    }

    /**
     * Returns {value, nextIndex}.
     */
    private static long[] readVarint(String encoded, int start) {
        long result = 0;
        int shift = 0;
        int index = start;
        int chunk;
        do {
            if (index >= encoded.length()) {
                throw new DecodeException("Polyline truncated at offset " + index);
            }
            char c = encoded.charAt(index++);
            if (c < MIN_CHAR || c > MAX_CHAR) {
                throw new DecodeException("Invalid polyline character '" + c + "' at offset " + (index - 1));
            }
            if (shift > MAX_SHIFT) {
                throw new DecodeException("Polyline varint overflow at offset " + (index - 1));
            }
            chunk = c - MIN_CHAR;
            result |= (long) (chunk & 0x1f) << shift;
            shift += 5;
        } while (chunk >= 0x20);

        long value = (result & 1) != 0 ? ~(result >> 1) : (result >> 1);
        return new long[]{value, index};
    }

    private static void writeVarint(long value, StringBuilder out) {
        long v = value < 0 ? ~(value << 1) : (value << 1);
        while (v >= 0x20) {
            out.append((char) ((0x20 | (v & 0x1f)) + MIN_CHAR));
            v >>= 5;
        }
        out.append((char) (v + MIN_CHAR));
    }

    private static void checkPrecision(int precision) {
        if (precision < 0 || precision > 9) {
            throw new IllegalArgumentException("Polyline precision must be between 0 and 9, got " + precision);
        }
    }
}
