package com.tripplanner.routing.service;

import com.tripplanner.routing.client.routing.OsrmAdapter;
import com.tripplanner.routing.client.routing.RoutingAdapter;
import com.tripplanner.routing.client.routing.RoutingCall;
import com.tripplanner.routing.client.routing.SelfHostedValhallaAdapter;
import com.tripplanner.routing.client.routing.StadiaMapsAdapter;
import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.error.ProviderException;
import com.tripplanner.routing.error.QuotaExceededException;
import com.tripplanner.routing.error.RoutingException;
import com.tripplanner.routing.error.RoutingUnavailableException;
import com.tripplanner.routing.model.RouteResult;
import com.tripplanner.routing.model.StylePreference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks the routing adapters in preference order under one time budget. Each adapter is tried at most once;
 * the first successful route wins.
 */
@Slf4j
@Service
public class ProviderChain {

    private final RoutingAdapter stadia;
    private final RoutingAdapter valhalla;
    private final RoutingAdapter osrm;
    private final ProviderQuotaService quotaService;
    private final RoutingProperties properties;
    private final Clock clock;

    @Autowired
    public ProviderChain(StadiaMapsAdapter stadia,
                         SelfHostedValhallaAdapter valhalla,
                         OsrmAdapter osrm,
                         ProviderQuotaService quotaService,
                         RoutingProperties properties,
                         Clock clock) {
        this(stadia, (RoutingAdapter) valhalla, osrm, quotaService, properties, clock);
    }

    ProviderChain(RoutingAdapter stadia,
                  RoutingAdapter valhalla,
                  RoutingAdapter osrm,
                  ProviderQuotaService quotaService,
                  RoutingProperties properties,
                  Clock clock) {
        this.stadia = stadia;
        this.valhalla = valhalla;
        this.osrm = osrm;
        this.quotaService = quotaService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Adapter order for a style: Valhalla-backed engines first for detour styles, OSRM first otherwise.
     */
    public List<RoutingAdapter> orderFor(StylePreference preference) {
        if (preference != null && preference.isDetourStyle()) {
            return List.of(stadia, valhalla, osrm);
        }
        return List.of(osrm, stadia);
    }

    public RouteResult route(RoutingCall call) {
        List<RoutingAdapter> order = orderFor(call.preference());
        long deadline = clock.millis() + properties.getChain().getBudget();
        List<String> failures = new ArrayList<>();

        for (RoutingAdapter adapter : order) {
            long remaining = deadline - clock.millis();
            if (remaining <= 0) {
                failures.add(adapter.provider().id() + ": chain budget exhausted");
                log.warn("Routing budget exhausted before {}", adapter.provider().id());
                break;
            }
            if (!adapter.isAvailable()) {
                failures.add(adapter.provider().id() + ": unavailable");
                log.info("Skipping {}: unavailable", adapter.provider().id());
                continue;
            }

            RouteResult result;
            try {
                log.info("Trying {} ({} stops, {}, {})", adapter.provider().id(), call.locations().size(),
                        call.profile().id(), StylePreference.tokenOf(call.preference()));
                result = adapter.route(call, Duration.ofMillis(remaining));
            } catch (QuotaExceededException e) {
                failures.add(e.getMessage());
                log.info("Skipping {}: {}", adapter.provider().id(), e.getMessage());
                continue;
            } catch (ProviderException e) {
                failures.add(e.getMessage());
                log.warn("Provider {} failed: {}", adapter.provider().id(), e.getMessage());
                continue;
            } catch (RoutingException e) {
                failures.add(adapter.provider().id() + ": " + e.getMessage());
                log.warn("Provider {} failed: {}", adapter.provider().id(), e.getMessage());
                continue;
            }

            recordUsage(adapter);
            log.info("Route from {}: {} km, {} min", adapter.provider().id(),
                    Math.round(result.distance() / 1000), Math.round(result.duration() / 60));
            return result;
        }

        log.error("All routing providers failed: {}", failures);
        throw new RoutingUnavailableException("No routing provider could compute the route", failures);
    }

    private void recordUsage(RoutingAdapter adapter) {
        try {
            quotaService.recordUsage(adapter.provider());
        } catch (Exception e) {
            log.warn("Could not record usage for {}: {}", adapter.provider().id(), e.getMessage());
        }
    }
}
