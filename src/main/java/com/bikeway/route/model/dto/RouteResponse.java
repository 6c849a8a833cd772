package com.bikeway.route.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RouteResponse", description = "Recommended routes, at most one per category")
public class RouteResponse {

    @Schema(description = "Routes in category order")
    private List<RouteDto> routes;

    @Schema(description = "Processing time (ms)", example = "842")
    private long processingTime;

}
