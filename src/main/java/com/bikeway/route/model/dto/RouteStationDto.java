package com.bikeway.route.model.dto;

import com.bikeway.route.model.domain.Station;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RouteStation", description = "Bike-share station used by a route")
public class RouteStationDto {
    @Schema(description = "Station number", example = "1001")
    private String number;
    @Schema(description = "Station name", example = "Yeouido Park")
    private String name;
    @Schema(description = "Latitude", example = "37.5291")
    private double lat;
    @Schema(description = "Longitude", example = "126.934")
    private double lng;
    @JsonProperty("current_bikes")
    @Schema(description = "Bikes available right now", example = "12")
    private int currentBikes;

    public static RouteStationDto from(Station station) {
        if (station == null) {
            return null;
        }
        return RouteStationDto.builder()
                .number(station.getNumber() != null ? station.getNumber() : station.getId())
                .name(station.getName())
                .lat(station.getLat())
                .lng(station.getLng())
                .currentBikes(station.getCurrentBikes())
                .build();
    }
}
