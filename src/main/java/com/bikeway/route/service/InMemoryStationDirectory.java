package com.bikeway.route.service;

import com.bikeway.route.config.RoutingProperties;
import com.bikeway.route.model.domain.Coordinate;
import com.bikeway.route.model.domain.Station;
import com.bikeway.route.model.domain.StationStatus;
import com.bikeway.route.util.GeoMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.List;

/**
 * Station inventory loaded once from a JSON snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryStationDirectory implements StationDirectory {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final RoutingProperties properties;

    private volatile List<Station> stations = List.of();

    @PostConstruct
    public void load() {
        Resource resource = resourceLoader.getResource(properties.getStation().getSnapshot());
        if (!resource.exists()) {
            log.warn("Station snapshot {} not found, directory is empty", properties.getStation().getSnapshot());
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            stations = List.copyOf(objectMapper.readValue(in, new TypeReference<List<Station>>() {
            }));
            log.info("Loaded {} stations from {}", stations.size(), properties.getStation().getSnapshot());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read station snapshot " + properties.getStation().getSnapshot(), e);
        }
    }

    @Override
    public List<Station> findNearbyStations(double lat, double lng) {
        Coordinate origin = new Coordinate(lat, lng);
        double radius = properties.getStation().getSearchRadius();

        return stations.stream()
                .filter(s -> s.getStatus() != StationStatus.INACTIVE)
                .filter(s -> s.getCurrentBikes() > 0)
                .filter(s -> GeoMetrics.distance(origin, s.coordinate()) <= radius)
                .sorted(Comparator.comparingDouble(s -> GeoMetrics.distance(origin, s.coordinate())))
                .limit(properties.getStation().getNearbyLimit())
                .toList();
    }

    @Override
    public List<Station> findAll() {
        return stations;
    }

    void replaceAll(List<Station> snapshot) {
        this.stations = List.copyOf(snapshot);
    }
}
