package com.bikeway.route.model.external.graphhopper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PathDetails {

    @JsonProperty("road_class")
    private List<DetailInterval> roadClass;

    @JsonProperty("bike_network")
    private List<DetailInterval> bikeNetwork;
}
