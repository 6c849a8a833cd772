package com.bikeway.route.util;

import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.domain.MaxGradients;
import com.bikeway.route.model.dto.BoundingBoxDto;
import com.bikeway.route.model.external.graphhopper.DetailInterval;
import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import com.bikeway.route.model.external.graphhopper.PathDetails;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Distance, bounds and road-quality metrics over engine paths. Point arrays are {@code [lng, lat, elevation?]}.
 */
public final class GeoMetrics {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    public static final Set<String> BIKE_ROAD_CLASSES = Set.of(
            "cycleway",
            "path",
            "track",
            "living_street",
            "service",
            "residential"
    );

    static final double MIN_SEGMENT_DISTANCE = 10;
    static final double MAX_REALISTIC_GRADIENT = 15;
    static final int SMOOTHING_WINDOW_SIZE = 5;
    static final double DISTANCE_TOLERANCE = 10;
    static final long TIME_TOLERANCE_MS = 5000;

    private static final String MISSING_NETWORK = "missing";

    private GeoMetrics() {
    }

    public static double distance(Coordinate a, Coordinate b) {
        return haversine(a.lat(), a.lng(), b.lat(), b.lng());
    }

    public static double distance(double[] a, double[] b) {
        return haversine(a[1], a[0], b[1], b[0]);
    }

    private static double haversine(double lat1Deg, double lng1Deg, double lat2Deg, double lng2Deg) {
        double lat1 = Math.toRadians(lat1Deg);
        double lat2 = Math.toRadians(lat2Deg);
        double dLat = lat2 - lat1;
        double dLng = Math.toRadians(lng2Deg - lng1Deg);
        double sinLat = Math.sin(dLat / 2);
        double sinLng = Math.sin(dLng / 2);
        double h = sinLat * sinLat + Math.cos(lat1) * Math.cos(lat2) * sinLng * sinLng;
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Union of every point of every path; an all-zero box when there are no points.
     */
    public static BoundingBoxDto boundingBox(List<GraphHopperPath> paths) {
        double minLat = Double.POSITIVE_INFINITY;
        double minLng = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        double maxLng = Double.NEGATIVE_INFINITY;
        boolean any = false;

        for (GraphHopperPath path : paths) {
            if (path == null) {
                continue;
            }
            for (double[] point : path.coordinates()) {
                any = true;
                minLng = Math.min(minLng, point[0]);
                minLat = Math.min(minLat, point[1]);
                maxLng = Math.max(maxLng, point[0]);
                maxLat = Math.max(maxLat, point[1]);
            }
        }

        if (!any) {
            return BoundingBoxDto.empty();
        }
        return new BoundingBoxDto(minLat, minLng, maxLat, maxLng);
    }

    /**
     * Share of the path, in percent, that runs on bike-friendly road classes or a signed bike network.
     */
    public static double bikeRoadRatio(GraphHopperPath path) {
        PathDetails details = path.getDetails();
        List<double[]> points = path.coordinates();
        if (details == null || details.getRoadClass() == null || points.isEmpty()) {
            return 0;
        }
        double totalDistance = path.getDistance();
        if (totalDistance <= 0) {
            return 0;
        }

        double[] cumulative = cumulativeDistances(points);
        List<DetailInterval> roadClasses = details.getRoadClass();
        double bikeRoadDistance = 0;

        for (DetailInterval interval : roadClasses) {
            if (isBikeRoadClass(interval.getValue())) {
                bikeRoadDistance += intervalDistance(interval, cumulative);
            }
        }

        if (details.getBikeNetwork() != null) {
            for (DetailInterval network : details.getBikeNetwork()) {
                String tag = network.getValue();
                if (tag == null || tag.isEmpty() || MISSING_NETWORK.equals(tag)) {
                    continue;
                }
                if (!coveredByBikeRoad(network, roadClasses)) {
                    bikeRoadDistance += intervalDistance(network, cumulative);
                }
            }
        }

        double ratio = bikeRoadDistance / totalDistance * 100;
        return Math.max(0, Math.min(ratio, 100));
    }

    /**
     * Sliding-window estimate of the steepest climb and descent. Elevations are smoothed first and
     * gradients above {@value #MAX_REALISTIC_GRADIENT}% are treated as elevation-model noise.
     */
    public static MaxGradients maxGradients(GraphHopperPath path) {
        List<double[]> points = path.coordinates();
        if (points.size() < 2) {
            return MaxGradients.FLAT;
        }

        double[] elevations = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            double[] point = points.get(i);
            elevations[i] = point.length > 2 ? point[2] : 0;
        }
        double[] smoothed = smoothElevations(elevations, SMOOTHING_WINDOW_SIZE);

        double maxUphill = 0;
        double maxDownhill = 0;
        Deque<double[]> window = new ArrayDeque<>();
        double windowDistance = 0;

        for (int i = 1; i < points.size(); i++) {
            double step = distance(points.get(i - 1), points.get(i));
            window.addLast(new double[]{i - 1, step});
            windowDistance += step;

            while (windowDistance >= MIN_SEGMENT_DISTANCE && window.size() > 1) {
                int startIdx = (int) window.peekFirst()[0];
                double elevationDiff = smoothed[i] - smoothed[startIdx];
                double horizontal = Math.sqrt(Math.max(
                        windowDistance * windowDistance - elevationDiff * elevationDiff, 0));

                if (horizontal > 0) {
                    double gradient = elevationDiff / horizontal * 100;
                    if (gradient > 0 && gradient <= MAX_REALISTIC_GRADIENT) {
                        maxUphill = Math.max(maxUphill, gradient);
                    } else if (gradient < 0 && -gradient <= MAX_REALISTIC_GRADIENT) {
                        maxDownhill = Math.max(maxDownhill, -gradient);
                    }
                }

                windowDistance -= window.pollFirst()[1];
            }
        }

        return new MaxGradients(roundOneDecimal(maxUphill), roundOneDecimal(maxDownhill));
    }

    /**
     * Net elevation change over distance, in percent, two decimals.
     */
    public static double averageGradient(GraphHopperPath path) {
        if (path.getDistance() == 0) {
            return 0;
        }
        double gradient = Math.abs(path.getAscend() - path.getDescend()) / path.getDistance() * 100;
        return Math.round(gradient * 100) / 100.0;
    }

    /**
     * Near-duplicate test used wherever two alternatives are compared.
     */
    public static boolean areSimilarPaths(GraphHopperPath a, GraphHopperPath b) {
        return Math.abs(a.getDistance() - b.getDistance()) < DISTANCE_TOLERANCE
                && Math.abs(a.getTime() - b.getTime()) < TIME_TOLERANCE_MS;
    }

    static double[] smoothElevations(double[] elevations, int windowSize) {
        if (windowSize < 2) {
            return elevations;
        }
        int half = windowSize / 2;
        double[] smoothed = new double[elevations.length];
        for (int i = 0; i < elevations.length; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(elevations.length - 1, i + half);
            double sum = 0;
            for (int j = from; j <= to; j++) {
                sum += elevations[j];
            }
            smoothed[i] = sum / (to - from + 1);
        }
        return smoothed;
    }

    static double[] cumulativeDistances(List<double[]> points) {
        double[] cumulative = new double[points.size()];
        for (int i = 1; i < points.size(); i++) {
            cumulative[i] = cumulative[i - 1] + distance(points.get(i - 1), points.get(i));
        }
        return cumulative;
    }

    private static double intervalDistance(DetailInterval interval, double[] cumulative) {
        int from = interval.getFrom();
        int to = interval.getTo();
        if (from < 0 || to >= cumulative.length || to < from) {
            return 0;
        }
        return cumulative[to] - cumulative[from];
    }

    private static boolean coveredByBikeRoad(DetailInterval network, List<DetailInterval> roadClasses) {
        return roadClasses.stream().anyMatch(road ->
                road.getFrom() <= network.getFrom()
                        && road.getTo() >= network.getTo()
                        && isBikeRoadClass(road.getValue()));
    }

    private static boolean isBikeRoadClass(String roadClass) {
        return roadClass != null && BIKE_ROAD_CLASSES.contains(roadClass);
    }

    private static double roundOneDecimal(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
