package com.bikeway.route.model.external.graphhopper;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * POST body for the engine's {@code /route} endpoint. Points are {@code [lng, lat]} pairs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphHopperRequest {
    private List<double[]> points;
    private String profile;
    private Boolean elevation;

    @JsonProperty("points_encoded")
    private Boolean pointsEncoded;

    private List<String> details;

    @JsonProperty("alternative_route.max_paths")
    private Integer maxPaths;

    private String algorithm;

    @JsonProperty("round_trip.distance")
    private Double roundTripDistance;

    @JsonProperty("round_trip.seed")
    private Long roundTripSeed;

    @JsonProperty("round_trip.points")
    private Integer roundTripPoints;

    @JsonProperty("ch.disable")
    private Boolean chDisable;
}
