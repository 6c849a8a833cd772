package com.bikeway.route.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum StationStatus {
    @JsonProperty("available")
    AVAILABLE,
    @JsonProperty("empty")
    EMPTY,
    @JsonProperty("inactive")
    INACTIVE
}
