package com.bikeway.route.service;

import com.bikeway.route.client.GraphHopperClient;
import com.bikeway.route.exception.JourneyValidationException;
import com.bikeway.route.exception.NoRouteFoundException;
import com.bikeway.route.model.domain.CategorizedPath;
import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.domain.JourneyRequest;
import com.bikeway.route.model.domain.JourneyShape;
import com.bikeway.route.model.domain.RouteCategory;
import com.bikeway.route.model.domain.Station;
import com.bikeway.route.model.dto.RouteDto;
import com.bikeway.route.model.dto.RouteResponse;
import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import com.bikeway.route.util.Futures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Entry point for journey planning. Picks the journey shape and drives
 * station lookup, engine calls, category selection and itinerary assembly.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JourneyOrchestrationService {

    private final StationLocatorService stationLocator;
    private final GraphHopperClient graphHopperClient;
    private final RouteOptimizerService routeOptimizer;
    private final RouteBuilderService routeBuilder;
    private final Executor routingExecutor;

    public RouteResponse planJourney(JourneyRequest request) {
        long startedAt = System.currentTimeMillis();
        JourneyShape shape = JourneyShape.of(request);
        log.info("=== JOURNEY PLANNING START === shape={}, start={}, end={}, waypoints={}",
                shape, request.start(), request.end(), request.waypointsOrEmpty().size());

        List<RouteDto> routes = switch (shape) {
            case DIRECT -> directJourney(request);
            case MULTI_WAYPOINT -> multiWaypointJourney(request);
            case ROUND_TRIP -> roundTripJourney(request);
            case CIRCULAR -> circularJourney(request);
        };

        return respond(routes, startedAt);
    }

    /**
     * A to B and back to A, starting and finishing at the station nearest A.
     */
    public RouteResponse planOutAndBack(JourneyRequest request) {
        long startedAt = System.currentTimeMillis();
        if (request.start() == null || request.end() == null) {
            throw new JourneyValidationException("Start and destination are required");
        }
        if (JourneyShape.isSameLocation(request.start(), request.end())) {
            throw new JourneyValidationException("Destination must differ from start for an out-and-back trip");
        }
        log.info("=== OUT-AND-BACK PLANNING START === start={}, turnaround={}, waypoints={}",
                request.start(), request.end(), request.waypointsOrEmpty().size());

        return respond(outAndBackJourney(request), startedAt);
    }

    private List<RouteDto> directJourney(JourneyRequest request) {
        log.info("Step 1/3: Resolving start and end stations...");
        StationPair stations = stationLocator.findPair(request.start(), request.end());
        Station startStation = stations.startStation();
        Station endStation = stations.endStation();
        log.info("Stations: {} -> {}", startStation.getName(), endStation.getName());

        log.info("Step 2/3: Walking legs and bike alternatives...");
        CompletableFuture<GraphHopperPath> walkToStart =
                async(() -> graphHopperClient.walkingRoute(request.start(), startStation.coordinate()));
        CompletableFuture<GraphHopperPath> walkFromEnd =
                async(() -> graphHopperClient.walkingRoute(endStation.coordinate(), request.end()));
        Futures.joinAll(List.of(walkToStart, walkFromEnd));

        List<CategorizedPath> bikePaths =
                routeOptimizer.optimalRoutes(startStation.coordinate(), endStation.coordinate());
        if (bikePaths.isEmpty()) {
            throw new NoRouteFoundException("No bike route between the selected stations");
        }

        log.info("Step 3/3: Assembling {} itineraries...", bikePaths.size());
        List<RouteDto> routes = new ArrayList<>();
        for (CategorizedPath bikePath : bikePaths) {
            RouteDto route = routeBuilder.buildThreeLegRoute(walkToStart.join(), bikePath.getPath(),
                    walkFromEnd.join(), startStation, endStation, bikePath.getRouteCategory());
            route.setRouteId(bikePath.getRouteId());
            routes.add(route);
        }
        return routes;
    }

    private List<RouteDto> multiWaypointJourney(JourneyRequest request) {
        log.info("Step 1/3: Resolving start and end stations...");
        StationPair stations = stationLocator.findPair(request.start(), request.end());
        Station startStation = stations.startStation();
        Station endStation = stations.endStation();

        List<Coordinate> points = new ArrayList<>();
        points.add(startStation.coordinate());
        points.addAll(request.waypointsOrEmpty());
        points.add(endStation.coordinate());

        log.info("Step 2/3: Walking legs, {} bike legs and the station-to-station lookup...", points.size() - 1);
        CompletableFuture<GraphHopperPath> walkToStart =
                async(() -> graphHopperClient.walkingRoute(request.start(), startStation.coordinate()));
        CompletableFuture<GraphHopperPath> walkFromEnd =
                async(() -> graphHopperClient.walkingRoute(endStation.coordinate(), request.end()));
        // Detail lookups resolve to this station-to-station pick, not to the per-leg geometry shown below.
        CompletableFuture<List<CategorizedPath>> direct =
                async(() -> routeOptimizer.optimalRoutes(startStation.coordinate(), endStation.coordinate()));
        List<List<GraphHopperPath>> legs = routeBuilder.fetchLegCandidates(points);
        Futures.joinAll(List.of(walkToStart, walkFromEnd));
        List<CategorizedPath> directPaths = Futures.join(direct);

        log.info("Step 3/3: Assembling itineraries per category...");
        List<RouteDto> routes = new ArrayList<>();
        for (RouteCategory category : RouteCategory.values()) {
            RouteDto route = routeBuilder.buildMultiLegRouteFromCandidates(legs, category,
                    walkToStart.join(), walkFromEnd.join(), startStation, endStation);
            route.setRouteId(routeIdFor(category, directPaths).orElse(null));
            routes.add(route);
        }
        return routes;
    }

    private List<RouteDto> roundTripJourney(JourneyRequest request) {
        log.info("Step 1/3: Resolving the round-trip station...");
        Station station = stationLocator.findSingle(request.start(), "round trip start");

        List<Coordinate> points = new ArrayList<>();
        points.add(station.coordinate());
        points.addAll(request.waypointsOrEmpty());
        points.add(station.coordinate());

        log.info("Step 2/3: Walking legs and {} bike legs...", points.size() - 1);
        CompletableFuture<GraphHopperPath> walkToStation =
                async(() -> graphHopperClient.walkingRoute(request.start(), station.coordinate()));
        CompletableFuture<GraphHopperPath> walkBack =
                async(() -> graphHopperClient.walkingRoute(station.coordinate(), request.start()));
        List<List<GraphHopperPath>> legs = routeBuilder.fetchLegCandidates(points);
        Futures.joinAll(List.of(walkToStation, walkBack));

        log.info("Step 3/3: Assembling itineraries per category...");
        List<RouteDto> routes = new ArrayList<>();
        for (RouteCategory category : RouteCategory.values()) {
            routes.add(routeBuilder.buildMultiLegRouteFromCandidates(legs, category,
                    walkToStation.join(), walkBack.join(), station, station));
        }
        return routes;
    }

    private List<RouteDto> circularJourney(JourneyRequest request) {
        double targetDistance = request.targetDistance();
        if (targetDistance <= 0) {
            throw new JourneyValidationException("Target distance must be positive");
        }

        log.info("Step 1/3: Resolving the circular course station...");
        Station station = stationLocator.findSingle(request.start(), "circular course start");

        log.info("Step 2/3: Walking legs and circular candidates for {} m...", targetDistance);
        CompletableFuture<GraphHopperPath> walkToStation =
                async(() -> graphHopperClient.walkingRoute(request.start(), station.coordinate()));
        CompletableFuture<GraphHopperPath> walkBack =
                async(() -> graphHopperClient.walkingRoute(station.coordinate(), request.start()));
        List<CategorizedPath> circularPaths = routeOptimizer.optimalCircularRoutes(station.coordinate(), targetDistance);
        Futures.joinAll(List.of(walkToStation, walkBack));

        if (circularPaths.isEmpty()) {
            log.warn("No circular course matched {} m around {}", targetDistance, station.getName());
            return List.of();
        }

        log.info("Step 3/3: Assembling {} itineraries...", circularPaths.size());
        List<RouteDto> routes = new ArrayList<>();
        for (CategorizedPath circular : circularPaths) {
            RouteDto route = routeBuilder.buildThreeLegRoute(walkToStation.join(), circular.getPath(),
                    walkBack.join(), station, station, circular.getRouteCategory());
            route.setRouteId(circular.getRouteId());
            routes.add(route);
        }
        return routes;
    }

    private List<RouteDto> outAndBackJourney(JourneyRequest request) {
        log.info("Step 1/3: Resolving the home station...");
        Station station = stationLocator.findSingle(request.start(), "out-and-back start");
        Coordinate turnaround = request.end();

        CompletableFuture<GraphHopperPath> walkToStation =
                async(() -> graphHopperClient.walkingRoute(request.start(), station.coordinate()));
        CompletableFuture<GraphHopperPath> walkBack =
                async(() -> graphHopperClient.walkingRoute(station.coordinate(), request.start()));

        List<RouteDto> routes = new ArrayList<>();
        if (request.waypointsOrEmpty().isEmpty()) {
            log.info("Step 2/3: Outbound and return alternatives...");
            CompletableFuture<List<CategorizedPath>> outbound =
                    async(() -> routeOptimizer.optimalRoutes(station.coordinate(), turnaround));
            CompletableFuture<List<CategorizedPath>> inbound =
                    async(() -> routeOptimizer.optimalRoutes(turnaround, station.coordinate()));
            Futures.joinAll(List.of(walkToStation, walkBack));
            List<CategorizedPath> returnPaths = Futures.join(inbound);

            log.info("Step 3/3: Pairing directions by category...");
            for (CategorizedPath out : Futures.join(outbound)) {
                returnPaths.stream()
                        .filter(back -> back.getRouteCategory() == out.getRouteCategory())
                        .findFirst()
                        .ifPresent(back -> routes.add(routeBuilder.buildFourLegRoundTrip(walkToStation.join(),
                                out.getPath(), back.getPath(), walkBack.join(), station, out.getRouteCategory())));
            }
            if (routes.isEmpty()) {
                throw new NoRouteFoundException("No out-and-back route to the turnaround point");
            }
            return routes;
        }

        List<Coordinate> points = new ArrayList<>();
        points.add(station.coordinate());
        points.addAll(request.waypointsOrEmpty());
        points.add(turnaround);
        points.add(station.coordinate());

        log.info("Step 2/3: Outbound legs through {} waypoints and the return leg...", request.waypointsOrEmpty().size());
        List<List<GraphHopperPath>> legs = routeBuilder.fetchLegCandidates(points);
        List<List<GraphHopperPath>> outboundLegs = legs.subList(0, legs.size() - 1);
        List<List<GraphHopperPath>> inboundLegs = legs.subList(legs.size() - 1, legs.size());
        Futures.joinAll(List.of(walkToStation, walkBack));

        log.info("Step 3/3: Merging directions per category...");
        for (RouteCategory category : RouteCategory.values()) {
            RouteDto out = routeBuilder.buildMultiLegRouteFromCandidates(outboundLegs, category,
                    walkToStation.join(), null, station, null);
            RouteDto back = routeBuilder.buildMultiLegRouteFromCandidates(inboundLegs, category,
                    null, walkBack.join(), null, station);
            routes.add(routeBuilder.mergeRoundTrip(out, back));
        }
        return routes;
    }

    private Optional<String> routeIdFor(RouteCategory category, List<CategorizedPath> paths) {
        return paths.stream()
                .filter(p -> p.getRouteCategory() == category)
                .map(CategorizedPath::getRouteId)
                .findFirst();
    }

    private <T> CompletableFuture<T> async(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, routingExecutor);
    }

    private RouteResponse respond(List<RouteDto> routes, long startedAt) {
        long elapsed = System.currentTimeMillis() - startedAt;
        log.info("=== JOURNEY PLANNING COMPLETE === {} routes in {} ms", routes.size(), elapsed);
        return RouteResponse.builder()
                .routes(routes)
                .processingTime(elapsed)
                .build();
    }
}
