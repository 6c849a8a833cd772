package com.bikeway.route.model.domain;

import com.bikeway.route.exception.JourneyValidationException;

import java.util.List;

public enum JourneyShape {
    DIRECT,
    MULTI_WAYPOINT,
    ROUND_TRIP,
    CIRCULAR;

    /**
     * Start and end closer than this on both axes (about 10 m) are treated as the same place.
     */
    public static final double SAME_LOCATION_TOLERANCE = 0.0001;

    public static JourneyShape of(JourneyRequest request) {
        if (request.start() == null) {
            throw new JourneyValidationException("Start coordinate is required");
        }
        if (request.end() == null) {
            if (request.targetDistance() != null) {
                return CIRCULAR;
            }
            throw new JourneyValidationException("Either an end coordinate or a target distance is required");
        }
        List<Coordinate> waypoints = request.waypointsOrEmpty();
        if (isSameLocation(request.start(), request.end())) {
            if (waypoints.isEmpty()) {
                throw new JourneyValidationException("A round trip needs at least one waypoint");
            }
            return ROUND_TRIP;
        }
        return waypoints.isEmpty() ? DIRECT : MULTI_WAYPOINT;
    }

    public static boolean isSameLocation(Coordinate a, Coordinate b) {
        return Math.abs(a.lat() - b.lat()) < SAME_LOCATION_TOLERANCE
                && Math.abs(a.lng() - b.lng()) < SAME_LOCATION_TOLERANCE;
    }
}
