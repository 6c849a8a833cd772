package com.bikeway.route.model.dto;

import com.bikeway.route.model.domain.RouteCategory;
import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "Route", description = "Complete itinerary made of walking and biking segments")
public class RouteDto {
    @Schema(description = "Route category", example = "bike_priority")
    private RouteCategory routeCategory;
    @Schema(description = "Handle for the stored route detail, valid for a few minutes",
            example = "3f2b7c1e-8a4d-4e8b-9d1a-6b0c2f4e5a7d-1a2b3c4d")
    private String routeId;
    private SummaryDto summary;
    private BoundingBoxDto bbox;
    private RouteStationDto startStation;
    private RouteStationDto endStation;
    private List<RouteSegmentDto> segments;
}
