package com.bikeway.route.cache;

import com.bikeway.route.config.RoutingProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalListener;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Route records expire a fixed time after they are written, whether or not anyone reads them.
 * The store is also bounded in size.
 */
@Slf4j
@Component
public class InMemoryRouteRecordStore implements RouteRecordStore {

    private final Cache<String, String> records;
    private final Duration ttl;
    private final String keyPrefix;

    @Autowired
    public InMemoryRouteRecordStore(RoutingProperties properties) {
        this(properties, Clock.systemUTC());
    }

    InMemoryRouteRecordStore(RoutingProperties properties, Clock clock) {
        RoutingProperties.RouteRecord config = properties.getRecord();
        this.ttl = config.getTtl();
        this.keyPrefix = config.getKeyPrefix();

        RemovalListener<String, String> removalListener = (key, json, cause) ->
                log.debug("Dropped route record {}. Reason: {}", key, cause);
        this.records = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(config.getMaxEntries())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .scheduler(Scheduler.systemScheduler())
                .removalListener(removalListener)
                .recordStats()
                .build();
    }

    @Override
    public void save(String routeId, String json) {
        records.put(key(routeId), json);
        log.debug("Stored route record {} (ttl {})", routeId, ttl);
    }

    @Override
    public Optional<String> find(String routeId) {
        return Optional.ofNullable(records.getIfPresent(key(routeId)));
    }

    /**
     * Entry count after pending expirations have been applied.
     */
    public RecordStats getStats() {
        records.cleanUp();
        CacheStats stats = records.stats();
        return new RecordStats(records.estimatedSize(), stats.hitCount(), stats.missCount());
    }

    private String key(String routeId) {
        return keyPrefix + routeId;
    }

    public record RecordStats(long entries, long hits, long misses) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0 : (double) hits / total;
        }
    }
}
