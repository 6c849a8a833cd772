package com.bikeway.route.exception;

/**
 * The engine answered but had no path for the request.
 */
public class NoRouteFoundException extends RouteException {

    public NoRouteFoundException(String message) {
        super(ErrorCode.NO_ROUTE_FOUND, message);
    }
}
