package com.bikeway.route.model.domain;

import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Categories exposed to riders, in display order. Each one knows how to pick its
 * representative out of a pool of alternatives.
 */
public enum RouteCategory {
    BIKE_PRIORITY("bike_priority", "Bike lane priority") {
        @Override
        public Optional<GraphHopperPath> pick(List<GraphHopperPath> candidates) {
            Optional<GraphHopperPath> safest = candidates.stream()
                    .filter(p -> BikeProfile.SAFE_BIKE.matches(p.getProfile()))
                    .min(Comparator.comparingLong(GraphHopperPath::getTime));
            return safest.isPresent() ? safest : candidates.stream().findFirst();
        }
    },
    SHORTEST("shortest", "Shortest distance") {
        @Override
        public Optional<GraphHopperPath> pick(List<GraphHopperPath> candidates) {
            return candidates.stream().min(Comparator.comparingDouble(GraphHopperPath::getDistance));
        }
    },
    FASTEST("fastest", "Fastest") {
        @Override
        public Optional<GraphHopperPath> pick(List<GraphHopperPath> candidates) {
            return candidates.stream().min(Comparator.comparingLong(GraphHopperPath::getTime));
        }
    };

    private final String code;
    private final String displayName;

    RouteCategory(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    /**
     * Ties resolve to the earliest candidate in pool order.
     */
    public abstract Optional<GraphHopperPath> pick(List<GraphHopperPath> candidates);

    @JsonValue
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }
}
