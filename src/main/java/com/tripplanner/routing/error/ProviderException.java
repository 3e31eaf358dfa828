package com.tripplanner.routing.error;

import com.tripplanner.routing.model.Provider;
import lombok.Getter;

/**
 * A single routing backend failed: network error, timeout, non-2xx status or unusable body.
 */
@Getter
public class ProviderException extends RoutingException {

    private final Provider provider;

    public ProviderException(Provider provider, String message) {
        super(provider.id() + ": " + message);
        this.provider = provider;
    }

    public ProviderException(Provider provider, String message, Throwable cause) {
        super(provider.id() + ": " + message, cause);
        this.provider = provider;
    }
}
