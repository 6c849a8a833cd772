package com.bikeway.route.service;

import com.bikeway.route.model.dto.RouteSegmentDto;
import com.bikeway.route.model.dto.SummaryDto;
import com.bikeway.route.model.external.graphhopper.GraphHopperPath;

/**
 * Running totals of an itinerary. Distance, ascent and descent are summed as reported, time is summed in
 * milliseconds and rounded once, and the bike-road ratio is averaged over biking distance only.
 */
final class JourneyTotals {

    private double distance;
    private long timeMillis;
    private double ascent;
    private double descent;
    private double bikeDistance;
    private double bikeRoadDistance;
    private Double maxGradient;

    void add(RouteSegmentDto segment, GraphHopperPath path) {
        distance += path.getDistance();
        timeMillis += path.getTime();
        ascent += path.getAscend();
        descent += path.getDescend();
        if (segment.isBiking()) {
            addBiking(segment.getSummary());
        }
    }

    /**
     * Adds a whole itinerary summary; time is already in seconds there.
     */
    void addItinerary(SummaryDto summary) {
        distance += summary.getDistance();
        timeMillis += summary.getTime() * 1000;
        ascent += summary.getAscent();
        descent += summary.getDescent();
    }

    void addBiking(SummaryDto bikeSummary) {
        bikeDistance += bikeSummary.getDistance();
        if (bikeSummary.getBikeRoadRatio() != null) {
            bikeRoadDistance += bikeSummary.getDistance() * bikeSummary.getBikeRoadRatio();
        }
        if (bikeSummary.getMaxGradient() != null) {
            maxGradient = maxGradient == null
                    ? bikeSummary.getMaxGradient()
                    : Math.max(maxGradient, bikeSummary.getMaxGradient());
        }
    }

    SummaryDto toSummary() {
        double ratio = bikeDistance > 0 ? roundTwoDecimals(bikeRoadDistance / bikeDistance) : 0;
        return SummaryDto.builder()
                .distance(distance)
                .time(Math.round(timeMillis / 1000.0))
                .ascent(ascent)
                .descent(descent)
                .bikeRoadRatio(ratio)
                .maxGradient(maxGradient)
                .build();
    }

    static double roundTwoDecimals(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
