package com.tripplanner.routing.error;

public class InvalidRouteRequestException extends RoutingException {

    public InvalidRouteRequestException(String message) {
        super(message);
    }
}
