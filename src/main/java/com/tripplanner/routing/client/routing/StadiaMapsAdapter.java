package com.tripplanner.routing.client.routing;

import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.error.QuotaExceededException;
import com.tripplanner.routing.model.Provider;
import com.tripplanner.routing.model.RouteResult;
import com.tripplanner.routing.service.ProviderQuotaService;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Hosted Valhalla from Stadia Maps. Metered: only used while this month's usage is under the quota.
 */
@Component
public class StadiaMapsAdapter extends AbstractValhallaAdapter {

    private static final String AUTH_SCHEME = "Stadia-Auth ";

    private final RoutingProperties properties;
    private final ProviderQuotaService quotaService;

    public StadiaMapsAdapter(WebClient webClient, RoutingProperties properties, ProviderQuotaService quotaService) {
        super(webClient);
        this.properties = properties;
        this.quotaService = quotaService;
    }

    @Override
    public Provider provider() {
        return Provider.STADIA;
    }

    @Override
    public boolean isAvailable() {
        return quotaService.shouldUsePrimaryHosted();
    }

    @Override
    public RouteResult route(RoutingCall call, Duration timeout) {
        if (!properties.getStadia().hasKey()) {
            throw new QuotaExceededException(provider(), "no API key configured");
        }
        if (!quotaService.shouldUsePrimaryHosted()) {
            throw new QuotaExceededException(provider(), "monthly quota of "
                    + properties.getStadia().getMonthlyQuota() + " reached");
        }
        return super.route(call, timeout);
    }

    @Override
    protected String routeUrl() {
        return properties.getStadia().getBaseUrl();
    }

    @Override
    protected int timeoutMillis() {
        return properties.getStadia().getTimeout();
    }

    @Override
    protected void authorize(HttpHeaders headers) {
        headers.set(HttpHeaders.AUTHORIZATION, AUTH_SCHEME + properties.getStadia().getKey());
    }
}
