package com.bikeway.route.model.domain;

import java.util.List;

/**
 * Validated journey parameters. {@code end} is absent for circular courses,
 * {@code targetDistance} (meters) is present only for them.
 */
public record JourneyRequest(Coordinate start, Coordinate end, List<Coordinate> waypoints, Double targetDistance) {

    public static JourneyRequest between(Coordinate start, Coordinate end, List<Coordinate> waypoints) {
        return new JourneyRequest(start, end, waypoints, null);
    }

    public static JourneyRequest circular(Coordinate start, double targetDistance) {
        return new JourneyRequest(start, null, List.of(), targetDistance);
    }

    public List<Coordinate> waypointsOrEmpty() {
        return waypoints == null ? List.of() : waypoints;
    }
}
