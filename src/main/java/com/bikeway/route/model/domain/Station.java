package com.bikeway.route.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Station {
    private String id;
    private String number;
    private String name;
    private double lat;
    private double lng;

    @JsonProperty("current_bikes")
    private int currentBikes;

    private StationStatus status;

    public Coordinate coordinate() {
        return new Coordinate(lat, lng);
    }

    public boolean isRentable() {
        return status == StationStatus.AVAILABLE && currentBikes > 0;
    }
}
