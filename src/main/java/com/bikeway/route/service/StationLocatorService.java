package com.bikeway.route.service;

import com.bikeway.route.exception.StationUnavailableException;
import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.domain.Station;
import com.bikeway.route.util.Futures;
import com.bikeway.route.util.GeoMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
@Service
@RequiredArgsConstructor
public class StationLocatorService {

    static final int FALLBACK_LIMIT = 10;

    private final StationDirectory stationDirectory;
    private final Executor routingExecutor;

    /**
     * Nearest station with a bike to rent. Live nearby search first, then a direct inventory scan.
     * Empty when nothing usable is around, which is a normal outcome.
     */
    public Optional<Station> findNearest(Coordinate coordinate) {
        try {
            List<Station> nearby = stationDirectory.findNearbyStations(coordinate.lat(), coordinate.lng());
            if (!nearby.isEmpty()) {
                return Optional.of(nearby.get(0));
            }

            log.warn("Nearby search found no station, scanning inventory. Coordinate: {}, {}",
                    coordinate.lat(), coordinate.lng());
            Optional<Station> fallback = nearestFromInventory(coordinate);
            if (fallback.isEmpty()) {
                log.warn("No available station near {}, {}", coordinate.lat(), coordinate.lng());
            }
            return fallback;

        } catch (RuntimeException e) {
            log.error("Nearby station search failed for {}, {}: {}",
                    coordinate.lat(), coordinate.lng(), e.getMessage(), e);
            log.warn("Retrying with an inventory scan. Coordinate: {}, {}", coordinate.lat(), coordinate.lng());
            return nearestFromInventory(coordinate);
        }
    }

    /**
     * Resolves both ends concurrently.
     *
     * @throws StationUnavailableException naming the side that has no station
     */
    public StationPair findPair(Coordinate start, Coordinate end) {
        CompletableFuture<Optional<Station>> startFuture =
                CompletableFuture.supplyAsync(() -> findNearest(start), routingExecutor);
        CompletableFuture<Optional<Station>> endFuture =
                CompletableFuture.supplyAsync(() -> findNearest(end), routingExecutor);

        Station startStation = Futures.join(startFuture)
                .orElseThrow(() -> new StationUnavailableException("start", start));
        Station endStation = Futures.join(endFuture)
                .orElseThrow(() -> new StationUnavailableException("destination", end));

        return new StationPair(startStation, endStation);
    }

    public Station findSingle(Coordinate coordinate, String purpose) {
        return findNearest(coordinate)
                .orElseThrow(() -> new StationUnavailableException(purpose, coordinate));
    }

    private Optional<Station> nearestFromInventory(Coordinate coordinate) {
        try {
            return stationDirectory.findAll().stream()
                    .filter(Station::isRentable)
                    .sorted(Comparator.comparingDouble(s -> GeoMetrics.distance(coordinate, s.coordinate())))
                    .limit(FALLBACK_LIMIT)
                    .findFirst();
        } catch (RuntimeException e) {
            log.error("Inventory scan failed for {}, {}: {}", coordinate.lat(), coordinate.lng(), e.getMessage());
            return Optional.empty();
        }
    }
}
