package com.bikeway.route.web.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "ErrorResponse", description = "Standard API error body")
public class ErrorResponse {
    @Schema(description = "Time of the failure", example = "2025-12-02T12:00:00Z")
    private OffsetDateTime timestamp;
    @Schema(description = "HTTP status", example = "422")
    private int status;
    @Schema(description = "Status reason", example = "Unprocessable Entity")
    private String error;
    @Schema(description = "Machine readable error code", example = "STATION_UNAVAILABLE")
    private String code;
    @Schema(description = "Error message", example = "No available bike station near start (37.500000, 127.000000)")
    private String message;
    @Schema(description = "Request path", example = "uri=/api/routes/full-journey")
    private String path;
    @Schema(description = "Field validation failures")
    private List<Violation> violations;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "Violation", description = "Failure for a single field")
    public static class Violation {
        @Schema(description = "Field", example = "start.lat")
        private String field;
        @Schema(description = "Message", example = "must be less than or equal to 90.0")
        private String message;
    }
}
