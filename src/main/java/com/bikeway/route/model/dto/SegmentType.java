package com.bikeway.route.model.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SegmentType {
    WALKING("walking"),
    BIKING("biking");

    private final String code;

    SegmentType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
