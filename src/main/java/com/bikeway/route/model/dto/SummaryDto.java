package com.bikeway.route.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "Summary", description = "Aggregated metrics of a route or segment")
public class SummaryDto {
    @Schema(description = "Distance (m)", example = "4235.7")
    private double distance;
    @Schema(description = "Duration (s)", example = "1012")
    private long time;
    @Schema(description = "Elevation gain (m)", example = "42.1")
    private double ascent;
    @Schema(description = "Elevation loss (m)", example = "38.4")
    private double descent;
    @Schema(description = "Share of bike-friendly roads (0.00 - 1.00), biking only", example = "0.78")
    private Double bikeRoadRatio;
    @Schema(description = "Steepest realistic climb (%), biking only", example = "8.5")
    private Double maxGradient;
    @Schema(description = "Net elevation change over distance (%), biking segments only", example = "0.12")
    private Double averageGradient;
}
