package com.tripplanner.routing.client.routing;

import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.Provider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Component
public class SelfHostedValhallaAdapter extends AbstractValhallaAdapter {

    private static final Duration PROBE_TTL = Duration.ofSeconds(30);

    private final RoutingProperties properties;
    private final Clock clock;

    private volatile boolean lastProbeHealthy;
    private volatile long lastProbeAt = Long.MIN_VALUE;

    public SelfHostedValhallaAdapter(WebClient webClient, RoutingProperties properties, Clock clock) {
        super(webClient);
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Provider provider() {
        return Provider.VALHALLA;
    }

    /**
     * Probes {@code /status}; the outcome is reused for a short while so a down instance costs one probe.
     */
    @Override
    public boolean isAvailable() {
        if (!properties.getValhalla().isEnabled()) {
            return false;
        }
        long now = clock.millis();
        if (lastProbeAt != Long.MIN_VALUE && now - lastProbeAt < PROBE_TTL.toMillis()) {
            return lastProbeHealthy;
        }
        boolean healthy = probe();
        lastProbeHealthy = healthy;
        lastProbeAt = now;
        return healthy;
    }

    private boolean probe() {
        try {
            webClient.get()
                    .uri(properties.getValhalla().getBaseUrl() + "/status")
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(Duration.ofMillis(properties.getValhalla().getStatusTimeout()))
                    .block();
            return true;
        } catch (Exception e) {
            log.warn("Self-hosted Valhalla at {} is not reachable: {}",
                    properties.getValhalla().getBaseUrl(), e.getMessage());
            return false;
        }
    }

    @Override
    protected String routeUrl() {
        return properties.getValhalla().getBaseUrl() + "/route";
    }

    @Override
    protected int timeoutMillis() {
        return properties.getValhalla().getTimeout();
    }
}
