package com.tripplanner.routing.error;

/**
 * Root of the engine's unchecked exceptions.
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
