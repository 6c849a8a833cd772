package com.bikeway.route.service;

import com.bikeway.route.cache.RouteRecordStore;
import com.bikeway.route.client.GraphHopperClient;
import com.bikeway.route.config.RoutingProperties;
import com.bikeway.route.model.domain.CategorizedPath;
import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.domain.RouteCategory;
import com.bikeway.route.model.external.graphhopper.GraphHopperPath;
import com.bikeway.route.util.GeoMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Reduces a pool of engine alternatives to one representative per {@link RouteCategory}
 * and stores each pick under a fresh route id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteOptimizerService {

    private final GraphHopperClient graphHopperClient;
    private final RouteRecordStore routeRecordStore;
    private final RouteIdGenerator routeIdGenerator;
    private final ObjectMapper objectMapper;
    private final RoutingProperties properties;
    private final Executor routingExecutor;

    public List<CategorizedPath> optimalRoutes(Coordinate from, Coordinate to) {
        List<GraphHopperPath> candidates = graphHopperClient.multipleProfileRoutes(from, to);
        return selectOptimal(candidates);
    }

    /**
     * At most one path per category, in category order. A candidate similar to an earlier pick is
     * never reused, so a category whose pool runs dry is left out.
     */
    public List<CategorizedPath> selectOptimal(List<GraphHopperPath> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        List<GraphHopperPath> picked = new ArrayList<>();
        List<CategorizedPath> result = new ArrayList<>();

        for (RouteCategory category : RouteCategory.values()) {
            List<GraphHopperPath> pool = candidates.stream()
                    .filter(candidate -> picked.stream().noneMatch(p -> GeoMetrics.areSimilarPaths(p, candidate)))
                    .toList();

            Optional<GraphHopperPath> choice = category.pick(pool);
            if (choice.isEmpty()) {
                log.debug("No distinct candidate left for {}", category.displayName());
                continue;
            }

            GraphHopperPath path = choice.get();
            picked.add(path);

            CategorizedPath categorized = CategorizedPath.builder()
                    .path(path)
                    .routeCategory(category)
                    .bikeRoadRatio(GeoMetrics.bikeRoadRatio(path))
                    .routeId(routeIdGenerator.generate(path))
                    .build();
            persist(categorized);
            result.add(categorized);
        }

        log.debug("Selected {} of {} candidates", result.size(), candidates.size());
        return result;
    }

    /**
     * Collects up to {@code targetCandidates} distinct round trips whose length is within the configured
     * tolerance of {@code targetDistance}, then categorizes them. Fewer (even none) is a valid outcome.
     */
    public List<CategorizedPath> optimalCircularRoutes(Coordinate start, double targetDistance) {
        RoutingProperties.Circular circular = properties.getCircular();
        double minDistance = targetDistance * (1 - circular.getTolerance());
        double maxDistance = targetDistance * (1 + circular.getTolerance());

        List<GraphHopperPath> kept = new ArrayList<>();
        int attempt = 0;

        while (kept.size() < circular.getTargetCandidates() && attempt < circular.getMaxAttempts()) {
            attempt++;
            for (GraphHopperPath path : graphHopperClient.circularRoutes(start, targetDistance)) {
                if (kept.size() >= circular.getTargetCandidates()) {
                    break;
                }
                boolean inWindow = path.getDistance() >= minDistance && path.getDistance() <= maxDistance;
                boolean distinct = kept.stream().noneMatch(k -> GeoMetrics.areSimilarPaths(k, path));
                if (inWindow && distinct) {
                    kept.add(path);
                }
            }
            log.debug("Circular attempt {}: {} candidates in [{}, {}] m", attempt, kept.size(), minDistance, maxDistance);
        }

        if (kept.isEmpty()) {
            log.warn("No circular route within {}% of {} m after {} attempts",
                    Math.round(circular.getTolerance() * 100), targetDistance, attempt);
        }
        return selectOptimal(kept);
    }

    private void persist(CategorizedPath categorized) {
        try {
            CompletableFuture.runAsync(() -> write(categorized), routingExecutor);
        } catch (RuntimeException e) {
            log.warn("Could not schedule route record {}: {}", categorized.getRouteId(), e.getMessage());
        }
    }

    private void write(CategorizedPath categorized) {
        try {
            routeRecordStore.save(categorized.getRouteId(), objectMapper.writeValueAsString(categorized));
        } catch (Exception e) {
            log.warn("Failed to store route record {}: {}", categorized.getRouteId(), e.getMessage());
        }
    }
}
