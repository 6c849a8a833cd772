package com.bikeway.route.web;

import com.bikeway.route.exception.ErrorCode;
import com.bikeway.route.exception.RouteException;
import com.bikeway.route.web.error.ErrorResponse;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ApiResponses({
            @ApiResponse(responseCode = "400", description = "Request validation failed",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          WebRequest request) {
        log.warn("Validation failed at {}: {}", request.getDescription(false), ex.getMessage());

        List<ErrorResponse.Violation> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toViolation)
                .collect(Collectors.toList());

        return build(ErrorCode.VALIDATION_ERROR, "Validation failed", request, violations);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                          WebRequest request) {
        log.warn("Unreadable request body at {}: {}", request.getDescription(false), ex.getMessage());
        return build(ErrorCode.VALIDATION_ERROR, "Malformed request body", request, null);
    }

    @ExceptionHandler(RouteException.class)
    @ApiResponses({
            @ApiResponse(responseCode = "404", description = "No route found or route detail expired",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "422", description = "No bike station near a required point",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Routing engine unavailable",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ErrorResponse> handleRoute(RouteException ex, WebRequest request) {
        if (ex.getErrorCode().status().is5xxServerError()) {
            log.error("{} at {}: {}", ex.getErrorCode(), request.getDescription(false), ex.getMessage(), ex);
        } else {
            log.warn("{} at {}: {}", ex.getErrorCode(), request.getDescription(false), ex.getMessage());
        }
        return build(ex.getErrorCode(), ex.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    @ApiResponses({
            @ApiResponse(responseCode = "500", description = "Internal server error",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex,
                                                       WebRequest request) {
        log.error("Unhandled exception occurred at path: {}", request.getDescription(false), ex);
        return build(ErrorCode.INTERNAL_ERROR, "Unexpected error while planning the route", request, null);
    }

    private ResponseEntity<ErrorResponse> build(ErrorCode code, String message, WebRequest request,
                                                List<ErrorResponse.Violation> violations) {
        HttpStatus status = code.status();
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(OffsetDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code.name())
                .message(message)
                .path(request.getDescription(false))
                .violations(violations)
                .build();

        return ResponseEntity.status(status).body(body);
    }

    private ErrorResponse.Violation toViolation(FieldError e) {
        return new ErrorResponse.Violation(e.getField(), e.getDefaultMessage());
    }
}
