package com.bikeway.route.model.domain;

import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Engine path selected for a category. Serialized flat (path fields plus category, ratio and id),
 * which is the layout of the persisted route record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CategorizedPath {

    @JsonUnwrapped
    private GraphHopperPath path;

    private RouteCategory routeCategory;

    /**
     * Percent, 0..100.
     */
    private double bikeRoadRatio;

    private String routeId;
}
