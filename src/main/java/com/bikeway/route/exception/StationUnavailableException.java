package com.bikeway.route.exception;

import com.bikeway.route.model.domain.Coordinate;
import lombok.Getter;

import java.util.Locale;

@Getter
public class StationUnavailableException extends RouteException {

    private final String side;

    public StationUnavailableException(String side, Coordinate coordinate) {
        super(ErrorCode.STATION_UNAVAILABLE, String.format(Locale.US,
                "No available bike station near %s (%.6f, %.6f)", side, coordinate.lat(), coordinate.lng()));
        this.side = side;
    }
}
