package com.bikeway.route.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    NO_ROUTE_FOUND(HttpStatus.NOT_FOUND),
    STATION_UNAVAILABLE(HttpStatus.UNPROCESSABLE_ENTITY),
    ROUTING_ENGINE_ERROR(HttpStatus.SERVICE_UNAVAILABLE),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    ROUTE_EXPIRED(HttpStatus.NOT_FOUND),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
