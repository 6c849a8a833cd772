package com.bikeway.route.exception;

import lombok.Getter;

/**
 * Base for failures that reach the caller as a structured error.
 */
@Getter
public abstract class RouteException extends RuntimeException {

    private final ErrorCode errorCode;

    protected RouteException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected RouteException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
