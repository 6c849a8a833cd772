package com.bikeway.route.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "routing")
public class RoutingProperties {
    private Engine engine = new Engine();
    private Station station = new Station();
    private Circular circular = new Circular();
    private RouteRecord record = new RouteRecord();

    @Data
    public static class Engine {
        private String baseUrl;
        private int timeout = 10000;
        private String walkingProfile = "foot";
    }

    @Data
    public static class Station {
        private String snapshot = "classpath:stations.json";
        private double searchRadius = 2000;
        private int nearbyLimit = 10;
    }

    @Data
    public static class Circular {
        private double tolerance = 0.1;
        private int maxAttempts = 10;
        private int targetCandidates = 3;
    }

    @Data
    public static class RouteRecord {
        private Duration ttl = Duration.ofSeconds(180);
        private String keyPrefix = "route:";
        private long maxEntries = 10_000;
    }

    @PostConstruct
    public void validate() {
        if (engine == null || engine.getBaseUrl() == null || engine.getBaseUrl().trim().isEmpty()) {
            log.error("Routing engine base URL is missing!");
            throw new IllegalStateException("Routing engine base URL is not configured");
        }

        log.info("==== Loaded Routing Configuration ====");
        log.info("Engine:");
        log.info("  baseUrl: {}", engine.getBaseUrl());
        log.info("  timeout: {}", engine.getTimeout());
        log.info("  walkingProfile: {}", engine.getWalkingProfile());
        log.info("Station:");
        log.info("  searchRadius: {}", station.getSearchRadius());
        log.info("  nearbyLimit: {}", station.getNearbyLimit());
        log.info("Circular:");
        log.info("  tolerance: {}", circular.getTolerance());
        log.info("  maxAttempts: {}", circular.getMaxAttempts());
        log.info("Route records:");
        log.info("  ttl: {}", record.getTtl());
        log.info("  maxEntries: {}", record.getMaxEntries());
        log.info("==== Routing Configuration Loaded Successfully ====");
    }

}
