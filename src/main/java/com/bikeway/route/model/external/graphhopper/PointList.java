package com.bikeway.route.model.external.graphhopper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PointList {
    private String type;
    private List<double[]> coordinates;

    public static PointList lineString(List<double[]> coordinates) {
        return new PointList("LineString", coordinates);
    }
}
