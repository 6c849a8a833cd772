package com.bikeway.route.model.external.graphhopper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One alternative returned by the routing engine. Coordinates are {@code [lng, lat, elevation?]}
 * and {@code bbox} is {@code [minLng, minLat, maxLng, maxLat]}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphHopperPath {
    private double distance;
    private long time;
    private double ascend;
    private double descend;
    private PointList points;
    private double[] bbox;
    private List<GraphHopperInstruction> instructions;
    private PathDetails details;
    private String profile;

    public List<double[]> coordinates() {
        if (points == null || points.getCoordinates() == null) {
            return List.of();
        }
        return points.getCoordinates();
    }
}
