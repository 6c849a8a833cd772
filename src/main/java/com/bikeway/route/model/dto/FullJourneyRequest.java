package com.bikeway.route.model.dto;

import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.domain.JourneyRequest;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "FullJourneyRequest", description = "Journey between two points, optionally through waypoints")
public class FullJourneyRequest {
    @NotNull
    @Valid
    @Schema(description = "Start point")
    private CoordinateDto start;
    @NotNull
    @Valid
    @Schema(description = "Destination; equal to start for a round trip")
    private CoordinateDto end;
    @Size(max = 3)
    @Schema(description = "Waypoints in visiting order (max 3)")
    private List<@Valid @NotNull CoordinateDto> waypoints;

    public JourneyRequest toJourneyRequest() {
        List<Coordinate> points = waypoints == null ? List.of() : waypoints.stream()
                .map(CoordinateDto::toCoordinate)
                .toList();
        return JourneyRequest.between(start.toCoordinate(), end.toCoordinate(), points);
    }
}
