package com.bikeway.route.exception;

public class JourneyValidationException extends RouteException {

    public JourneyValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
