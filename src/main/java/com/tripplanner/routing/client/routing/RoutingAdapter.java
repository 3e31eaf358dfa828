package com.tripplanner.routing.client.routing;

import com.tripplanner.routing.model.Provider;
import com.tripplanner.routing.model.RouteResult;

import java.time.Duration;

/**
 * One routing backend. Implementations translate a {@link RoutingCall} into the backend's wire format
 * and back; nothing backend-specific escapes the adapter.
 */
public interface RoutingAdapter {

    Provider provider();

    /**
     * Cheap pre-check (key configured, quota left, instance reachable). Unavailable adapters are skipped.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * @param timeout upper bound for this attempt, already capped by the remaining chain budget
     * @throws com.tripplanner.routing.error.ProviderException on any failure
     */
    RouteResult route(RoutingCall call, Duration timeout);
}
