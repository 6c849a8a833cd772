package com.bikeway.route.exception;

/**
 * Route detail was never stored or has already expired.
 */
public class RouteRecordNotFoundException extends RouteException {

    public RouteRecordNotFoundException(String routeId) {
        super(ErrorCode.ROUTE_EXPIRED, "Route " + routeId + " is no longer available");
    }
}
