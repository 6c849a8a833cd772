package com.bikeway.route.model.dto;

import com.bikeway.route.model.domain.BikeProfile;
import com.fasterxml.jackson.annotation.JsonIgnore;
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
@Schema(name = "RouteSegment", description = "One walking or biking leg of a route")
public class RouteSegmentDto {
    @Schema(description = "Leg type", example = "biking")
    private SegmentType type;
    private SummaryDto summary;
    private BoundingBoxDto bbox;
    private GeometryDto geometry;
    @Schema(description = "Bike profile, biking legs only", example = "safe_bike")
    private BikeProfile profile;
    private RouteStationDto startStation;
    private RouteStationDto endStation;

    @JsonIgnore
    public boolean isBiking() {
        return type == SegmentType.BIKING;
    }
}
