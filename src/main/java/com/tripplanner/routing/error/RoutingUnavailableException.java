package com.tripplanner.routing.error;

import lombok.Getter;

import java.util.List;

/**
 * Every provider in the chain failed. Callers may retry later.
 */
@Getter
public class RoutingUnavailableException extends RoutingException {

    private final List<String> failures;

    public RoutingUnavailableException(String message, List<String> failures) {
        super(message);
        this.failures = List.copyOf(failures);
    }

    public boolean isRetryable() {
        return true;
    }
}
