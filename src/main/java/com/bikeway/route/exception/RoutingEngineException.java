package com.bikeway.route.exception;

/**
 * Transport or HTTP failure talking to the routing engine.
 */
public class RoutingEngineException extends RouteException {

    public RoutingEngineException(String message, Throwable cause) {
        super(ErrorCode.ROUTING_ENGINE_ERROR, message, cause);
    }
}
