package com.tripplanner.routing.client.routing;

import com.tripplanner.routing.model.RouteResult;
import com.tripplanner.routing.model.StylePreference;

import java.util.Comparator;
import java.util.List;

/**
 * Picks one of several alternative routes according to the style preference.
 */
final class AlternativeSelector {

    private AlternativeSelector() {
    }

    static RouteResult select(List<RouteResult> candidates, StylePreference preference) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidate routes");
        }
        if (preference == null || candidates.size() == 1) {
            return candidates.get(0);
        }
        return switch (preference) {
            case SHORTEST -> candidates.stream()
                    .min(Comparator.comparingDouble(RouteResult::distance))
                    .orElseThrow();
            case FASTEST -> candidates.stream()
                    .min(Comparator.comparingDouble(RouteResult::duration))
                    .orElseThrow();
            case LONGEST -> candidates.stream()
                    .max(Comparator.comparingDouble(RouteResult::distance))
                    .orElseThrow();
            // the longest alternative tends to be a motorway detour; the runner-up is usually the scenic one
            case SCENIC -> candidates.stream()
                    .sorted(Comparator.comparingDouble(RouteResult::distance).reversed())
                    .skip(1)
                    .findFirst()
                    .orElseThrow();
        };
    }
}
