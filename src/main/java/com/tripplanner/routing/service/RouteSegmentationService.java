package com.tripplanner.routing.service;

import com.tripplanner.routing.error.InvalidRouteRequestException;
import com.tripplanner.routing.model.dto.OvernightStop;
import com.tripplanner.routing.model.dto.RouteSegment;
import com.tripplanner.routing.model.dto.SegmentLocation;
import com.tripplanner.routing.model.dto.SegmentationRequest;
import com.tripplanner.routing.util.GeoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a route into daily drives capped by driving time.
 */
@Slf4j
@Service
public class RouteSegmentationService {

    public static final LocalTime DEFAULT_START_TIME = LocalTime.of(9, 0);

    private static final long SECONDS_PER_HOUR = 3600;

    public List<RouteSegment> segmentByDrivingTime(SegmentationRequest request) {
        validate(request);
        List<double[]> geometry = request.getRouteGeometry();
        List<SegmentLocation> locations = request.getLocations();
        double totalHours = request.getTotalDurationHours();
        double cap = request.getMaxDrivingHoursPerDay();
        LocalDate date = request.getStartDate();
        LocalTime time = request.getStartTime() != null ? request.getStartTime() : DEFAULT_START_TIME;

        SegmentLocation origin = locations.get(0);
        SegmentLocation destination = locations.get(locations.size() - 1);

        if (totalHours <= cap) {
            LocalDateTime departure = LocalDateTime.of(date, time);
            return List.of(RouteSegment.builder()
                    .day(1)
                    .startLocation(origin)
                    .endLocation(destination)
                    .geometry(List.copyOf(geometry))
                    .drivingTimeHours(totalHours)
                    .distanceKm(request.getTotalDistanceKm())
                    .estimatedDepartureTime(departure)
                    .estimatedArrivalTime(arrival(departure, totalHours))
                    .build());
        }

        int numSegments = (int) Math.ceil(totalHours / cap);
        double hoursPerSegment = totalHours / numSegments;
        double[] cumulative = GeoUtils.cumulativeDistancesKm(geometry);
        double routeKm = cumulative[cumulative.length - 1];
        int lastIndex = geometry.size() - 1;
        boolean enoughVertices = lastIndex >= numSegments;

        List<RouteSegment> segments = new ArrayList<>(numSegments);
        int startIndex = 0;
        for (int i = 0; i < numSegments; i++) {
            boolean last = i == numSegments - 1;
            int endIndex;
            if (last) {
                endIndex = lastIndex;
            } else {
                double targetKm = ((i + 1) * hoursPerSegment / totalHours) * routeKm;
                endIndex = closestIndex(cumulative, targetKm);
                if (enoughVertices) {
                    // keep at least one vertex for each remaining segment
                    endIndex = Math.max(endIndex, startIndex + 1);
                    endIndex = Math.min(endIndex, lastIndex - (numSegments - 1 - i));
                }
            }

            double segmentKm = cumulative[endIndex] - cumulative[startIndex];
            double segmentHours = routeKm > 0 ? segmentKm / routeKm * totalHours : hoursPerSegment;

            SegmentLocation from = i == 0 ? origin : stop(i, geometry.get(startIndex));
            SegmentLocation to = last ? destination : stop(i + 1, geometry.get(endIndex));

            LocalDateTime departure = LocalDateTime.of(date, time);
            segments.add(RouteSegment.builder()
                    .day(i + 1)
                    .startLocation(from)
                    .endLocation(to)
                    .geometry(List.copyOf(geometry.subList(startIndex, endIndex + 1)))
                    .drivingTimeHours(segmentHours)
                    .distanceKm(segmentKm)
                    .estimatedDepartureTime(departure)
                    .estimatedArrivalTime(arrival(departure, segmentHours))
                    .build());

            startIndex = endIndex;
            date = date.plusDays(1);
            time = DEFAULT_START_TIME;
        }

        log.info("Route of {} h split into {} days (cap {} h)", totalHours, numSegments, cap);
        return segments;
    }

    public List<OvernightStop> calculateOvernightStops(List<RouteSegment> segments) {
        List<OvernightStop> stops = new ArrayList<>();
        for (int i = 0; i < segments.size() - 1; i++) {
            RouteSegment current = segments.get(i);
            RouteSegment next = segments.get(i + 1);
            stops.add(OvernightStop.builder()
                    .location(current.getEndLocation())
                    .day(current.getDay())
                    .arrivalTime(current.getEstimatedArrivalTime())
                    .departureTime(next.getEstimatedDepartureTime())
                    .stayDuration(OvernightStop.ONE_NIGHT)
                    .build());
        }
        return stops;
    }

    static int closestIndex(double[] cumulative, double target) {
        int closest = 0;
        double minDiff = Math.abs(cumulative[0] - target);
        for (int i = 1; i < cumulative.length; i++) {
            double diff = Math.abs(cumulative[i] - target);
            if (diff < minDiff) {
                minDiff = diff;
                closest = i;
            }
        }
        return closest;
    }

    private static SegmentLocation stop(int number, double[] position) {
        return new SegmentLocation("Stop " + number, position.clone());
    }

    private static LocalDateTime arrival(LocalDateTime departure, double hours) {
        return departure.plusSeconds(Math.round(hours * SECONDS_PER_HOUR));
    }

    private static void validate(SegmentationRequest request) {
        if (request == null) {
            throw new InvalidRouteRequestException("Segmentation request is required");
        }
        if (request.getMaxDrivingHoursPerDay() <= 0) {
            throw new InvalidRouteRequestException("maxDrivingHoursPerDay must be positive");
        }
        if (request.getRouteGeometry() == null || request.getRouteGeometry().size() < 2) {
            throw new InvalidRouteRequestException("Route geometry needs at least 2 positions");
        }
        if (request.getLocations() == null || request.getLocations().size() < 2) {
            throw new InvalidRouteRequestException("At least 2 locations are required");
        }
        if (request.getStartDate() == null) {
            throw new InvalidRouteRequestException("startDate is required");
        }
        if (request.getTotalDurationHours() < 0 || request.getTotalDistanceKm() < 0) {
            throw new InvalidRouteRequestException("Totals must not be negative");
        }
    }
}
