package com.bikeway.route.service;

import com.bikeway.route.client.GraphHopperClient;
import com.bikeway.route.exception.NoRouteFoundException;
import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.domain.RouteCategory;
import com.bikeway.route.model.domain.Station;
import com.bikeway.route.model.dto.RouteDto;
import com.bikeway.route.model.dto.RouteSegmentDto;
import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import com.bikeway.route.util.Futures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Composes walking and biking legs into itineraries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteBuilderService {

    private final RouteConverterService converter;
    private final GraphHopperClient graphHopperClient;
    private final Executor routingExecutor;

    public RouteDto buildThreeLegRoute(GraphHopperPath walkToStart, GraphHopperPath bikeLeg, GraphHopperPath walkFromEnd,
                                       Station startStation, Station endStation, RouteCategory category) {
        List<RouteSegmentDto> segments = List.of(
                converter.walking(walkToStart),
                converter.biking(bikeLeg, startStation, endStation),
                converter.walking(walkFromEnd));

        return converter.assemble(category, segments, List.of(walkToStart, bikeLeg, walkFromEnd),
                startStation, endStation);
    }

    /**
     * Walk to the station, ride out, ride back, walk home. Both rides start and end at {@code station}.
     */
    public RouteDto buildFourLegRoundTrip(GraphHopperPath walkToStation, GraphHopperPath bikeOut,
                                          GraphHopperPath bikeBack, GraphHopperPath walkToStart,
                                          Station station, RouteCategory category) {
        List<RouteSegmentDto> segments = List.of(
                converter.walking(walkToStation),
                converter.biking(bikeOut, station, null),
                converter.biking(bikeBack, null, station),
                converter.walking(walkToStart));

        return converter.assemble(category, segments, List.of(walkToStation, bikeOut, bikeBack, walkToStart),
                station, station);
    }

    /**
     * Bike candidates for every consecutive pair of {@code points}, both profiles, in leg order.
     * Legs are requested concurrently.
     */
    public List<List<GraphHopperPath>> fetchLegCandidates(List<Coordinate> points) {
        if (points.size() < 2) {
            throw new IllegalArgumentException("A multi-leg route needs at least two points");
        }

        List<CompletableFuture<List<GraphHopperPath>>> legs = new ArrayList<>();
        for (int i = 0; i < points.size() - 1; i++) {
            int leg = i;
            Coordinate from = points.get(i);
            Coordinate to = points.get(i + 1);
            legs.add(CompletableFuture.supplyAsync(() -> legCandidates(leg, from, to), routingExecutor));
        }
        return Futures.joinAll(legs);
    }

    public RouteDto buildMultiLegRoute(List<Coordinate> points, RouteCategory category,
                                       GraphHopperPath walkToStart, GraphHopperPath walkFromEnd,
                                       Station startStation, Station endStation) {
        return buildMultiLegRouteFromCandidates(fetchLegCandidates(points), category, walkToStart, walkFromEnd,
                startStation, endStation);
    }

    /**
     * One biking segment per leg, chosen by the category's rule, wrapped by the optional walks.
     * The start station is attached to the first ride and the end station to the last.
     */
    public RouteDto buildMultiLegRouteFromCandidates(List<List<GraphHopperPath>> legCandidates,
                                                     RouteCategory category,
                                                     GraphHopperPath walkToStart, GraphHopperPath walkFromEnd,
                                                     Station startStation, Station endStation) {
        List<RouteSegmentDto> segments = new ArrayList<>();
        List<GraphHopperPath> paths = new ArrayList<>();

        if (walkToStart != null) {
            segments.add(converter.walking(walkToStart));
            paths.add(walkToStart);
        }

        int lastLeg = legCandidates.size() - 1;
        for (int i = 0; i <= lastLeg; i++) {
            int leg = i;
            GraphHopperPath chosen = category.pick(legCandidates.get(i))
                    .orElseThrow(() -> new NoRouteFoundException("No bike route for leg " + (leg + 1)));
            segments.add(converter.biking(chosen,
                    i == 0 ? startStation : null,
                    i == lastLeg ? endStation : null));
            paths.add(chosen);
        }

        if (walkFromEnd != null) {
            segments.add(converter.walking(walkFromEnd));
            paths.add(walkFromEnd);
        }

        return converter.assemble(category, segments, paths, startStation, endStation);
    }

    /**
     * Joins the outbound and return itineraries of an out-and-back trip, outbound segments first.
     */
    public RouteDto mergeRoundTrip(RouteDto outbound, RouteDto inbound) {
        JourneyTotals totals = new JourneyTotals();
        totals.addItinerary(outbound.getSummary());
        totals.addItinerary(inbound.getSummary());

        List<RouteSegmentDto> segments = new ArrayList<>(outbound.getSegments());
        segments.addAll(inbound.getSegments());
        segments.stream()
                .filter(RouteSegmentDto::isBiking)
                .forEach(s -> totals.addBiking(s.getSummary()));

        return RouteDto.builder()
                .routeCategory(outbound.getRouteCategory())
                .summary(totals.toSummary())
                .bbox(outbound.getBbox().union(inbound.getBbox()))
                .startStation(outbound.getStartStation())
                .endStation(inbound.getEndStation())
                .segments(segments)
                .build();
    }

    private List<GraphHopperPath> legCandidates(int leg, Coordinate from, Coordinate to) {
        List<GraphHopperPath> candidates = graphHopperClient.multipleProfileRoutes(from, to);
        if (candidates.isEmpty()) {
            throw new NoRouteFoundException(String.format(Locale.US,
                    "No bike route for leg %d (%.6f, %.6f) -> (%.6f, %.6f)",
                    leg + 1, from.lat(), from.lng(), to.lat(), to.lng()));
        }
        log.debug("Leg {} has {} candidates", leg + 1, candidates.size());
        return candidates;
    }
}
