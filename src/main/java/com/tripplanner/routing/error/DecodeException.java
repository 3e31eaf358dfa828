package com.tripplanner.routing.error;

public class DecodeException extends RoutingException {

    public DecodeException(String message) {
        super(message);
    }
}
