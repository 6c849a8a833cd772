package com.bikeway.route.client;

import com.bikeway.route.config.RoutingProperties;
import com.bikeway.route.exception.NoRouteFoundException;
import com.bikeway.route.exception.RouteException;
import com.bikeway.route.exception.RoutingEngineException;
import com.bikeway.route.model.domain.BikeProfile;
import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import com.bikeway.route.model.external.graphhopper.GraphHopperRequest;
import com.bikeway.route.model.external.graphhopper.GraphHopperResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Blocking facade over the routing engine's {@code POST /route}. Empty results and the engine's
 * "no connection" replies raise {@link NoRouteFoundException}; other transport and HTTP failures
 * raise {@link RoutingEngineException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphHopperClient {

    private static final String ROUTE_ENDPOINT = "/route";
    private static final List<String> DETAILS = List.of("road_class", "bike_network");
    private static final String ROUND_TRIP_ALGORITHM = "round_trip";
    private static final int DEFAULT_MAX_PATHS = 3;
    private static final int ROUND_TRIP_POINTS = 2;
    private static final int SEED_BOUND = 1000;
    private static final List<String> NO_CONNECTION_MESSAGES = List.of(
            "Connection between locations not found",
            "Cannot find point");

    private final WebClient webClient;
    private final RoutingProperties properties;
    private final Random routingRandom;

    public GraphHopperPath singleRoute(Coordinate from, Coordinate to, String profile) {
        GraphHopperRequest request = baseRequest(List.of(from.toLngLat(), to.toLngLat()), profile).build();

        List<GraphHopperPath> paths = route(request, profile);
        if (paths.isEmpty()) {
            log.warn("Engine returned no path. Profile: {}, From: {}, To: {}", profile, from, to);
            throw new NoRouteFoundException("No route found for profile " + profile);
        }
        return tag(paths.get(0), profile);
    }

    public GraphHopperPath walkingRoute(Coordinate from, Coordinate to) {
        return singleRoute(from, to, properties.getEngine().getWalkingProfile());
    }

    public List<GraphHopperPath> alternativeRoutes(Coordinate from, Coordinate to, String profile, int maxPaths) {
        GraphHopperRequest request = baseRequest(List.of(from.toLngLat(), to.toLngLat()), profile)
                .maxPaths(maxPaths)
                .chDisable(true)
                .build();

        List<GraphHopperPath> paths = route(request, profile);
        if (paths.isEmpty()) {
            log.warn("Engine returned no alternatives. Profile: {}, From: {}, To: {}", profile, from, to);
            throw new NoRouteFoundException("No alternative routes found for profile " + profile);
        }
        return paths.stream().map(path -> tag(path, profile)).toList();
    }

    public List<GraphHopperPath> alternativeRoutes(Coordinate from, Coordinate to, String profile) {
        return alternativeRoutes(from, to, profile, DEFAULT_MAX_PATHS);
    }

    /**
     * Alternatives for every bike profile, concatenated in profile order. A failing profile is skipped.
     */
    public List<GraphHopperPath> multipleProfileRoutes(Coordinate from, Coordinate to) {
        List<GraphHopperPath> all = new ArrayList<>();
        for (BikeProfile profile : BikeProfile.values()) {
            try {
                all.addAll(alternativeRoutes(from, to, profile.code(), DEFAULT_MAX_PATHS));
            } catch (RouteException e) {
                log.warn("Skipping profile {} for {} -> {}: {}", profile.code(), from, to, e.getMessage());
            }
        }
        log.debug("Multi-profile search {} -> {} returned {} paths", from, to, all.size());
        return all;
    }

    public List<GraphHopperPath> circularRoutes(Coordinate start, double targetDistance) {
        List<GraphHopperPath> all = new ArrayList<>();
        for (BikeProfile profile : BikeProfile.values()) {
            GraphHopperRequest request = roundTripRequest(start, profile.code(), targetDistance)
                    .maxPaths(DEFAULT_MAX_PATHS)
                    .build();
            try {
                route(request, profile.code()).forEach(path -> all.add(tag(path, profile.code())));
            } catch (RouteException e) {
                log.warn("Skipping circular search for profile {} ({} m): {}",
                        profile.code(), targetDistance, e.getMessage());
            }
        }
        log.debug("Circular search around {} for {} m returned {} paths", start, targetDistance, all.size());
        return all;
    }

    public GraphHopperPath singleCircularRoute(Coordinate start, String profile, double targetDistance) {
        GraphHopperRequest request = roundTripRequest(start, profile, targetDistance).build();

        List<GraphHopperPath> paths = route(request, profile);
        if (paths.isEmpty()) {
            log.warn("Engine returned no round trip. Profile: {}, Distance: {} m", profile, targetDistance);
            throw new NoRouteFoundException("No round trip route found for profile " + profile);
        }
        return tag(paths.get(0), profile);
    }

    private GraphHopperRequest.GraphHopperRequestBuilder roundTripRequest(Coordinate start, String profile,
                                                                          double targetDistance) {
        return baseRequest(List.of(start.toLngLat()), profile)
                .algorithm(ROUND_TRIP_ALGORITHM)
                .chDisable(true)
                .roundTripDistance(targetDistance)
                .roundTripSeed((long) routingRandom.nextInt(SEED_BOUND))
                .roundTripPoints(ROUND_TRIP_POINTS);
    }

    private GraphHopperRequest.GraphHopperRequestBuilder baseRequest(List<double[]> points, String profile) {
        return GraphHopperRequest.builder()
                .points(points)
                .profile(profile)
                .elevation(true)
                .pointsEncoded(false)
                .details(DETAILS);
    }

    private List<GraphHopperPath> route(GraphHopperRequest request, String profile) {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getEngine().getBaseUrl())
                .path(ROUTE_ENDPOINT)
                .toUriString();

        GraphHopperResponse response;
        try {
            response = webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(GraphHopperResponse.class)
                    .block();
        } catch (WebClientResponseException e) {
            if (isNoConnection(e)) {
                log.warn("Engine found no connection. Profile: {}, Body: {}", profile, e.getResponseBodyAsString());
                throw new NoRouteFoundException("No route found for profile " + profile);
            }
            log.error("Engine call failed. Profile: {}, Status: {}, Body: {}",
                    profile, e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new RoutingEngineException(
                    "Routing engine responded with status " + e.getStatusCode().value(), e);
        } catch (WebClientException e) {
            log.error("Engine call failed. Profile: {}, Error: {}", profile, e.getMessage());
            throw new RoutingEngineException("Routing engine is unreachable", e);
        }

        if (response == null || response.getPaths() == null) {
            return List.of();
        }
        if (response.getInfo() != null) {
            log.debug("Engine answered {} paths for {} in {} ms",
                    response.getPaths().size(), profile, response.getInfo().getTook());
        }
        return response.getPaths();
    }

    /**
     * The engine answers an unroutable request with a 4xx and a message, not with an empty path list.
     */
    private boolean isNoConnection(WebClientResponseException e) {
        if (!e.getStatusCode().is4xxClientError()) {
            return false;
        }
        String body = e.getResponseBodyAsString();
        return NO_CONNECTION_MESSAGES.stream().anyMatch(body::contains);
    }

    private GraphHopperPath tag(GraphHopperPath path, String profile) {
        return path.toBuilder().profile(profile).build();
    }
}
