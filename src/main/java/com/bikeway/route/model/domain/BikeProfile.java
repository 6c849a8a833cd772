package com.bikeway.route.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BikeProfile {
    SAFE_BIKE("safe_bike"),
    FAST_BIKE("fast_bike");

    private final String code;

    BikeProfile(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean matches(String profile) {
        return code.equals(profile);
    }

    public static BikeProfile fromCode(String profile) {
        for (BikeProfile value : values()) {
            if (value.matches(profile)) {
                return value;
            }
        }
        return null;
    }
}
