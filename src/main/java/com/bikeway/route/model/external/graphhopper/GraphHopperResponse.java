package com.bikeway.route.model.external.graphhopper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphHopperResponse {
    private List<GraphHopperPath> paths;
    private Info info;
    private String message;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Info {
        private long took;
    }
}
