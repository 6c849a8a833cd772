package com.bikeway.route.model.dto;

import com.bikeway.route.model.domain.JourneyRequest;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "CircularRouteRequest", description = "Circular course of a given length starting and ending at one point")
public class CircularRouteRequest {
    @NotNull
    @Valid
    @Schema(description = "Start and finish point")
    private CoordinateDto start;
    @NotNull
    @Min(100)
    @Max(50000)
    @Schema(description = "Target distance (m)", example = "5000")
    private Double targetDistance;

    public JourneyRequest toJourneyRequest() {
        return JourneyRequest.circular(start.toCoordinate(), targetDistance);
    }
}
