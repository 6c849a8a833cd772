package com.bikeway.route.service;

import com.bikeway.route.cache.RouteRecordStore;
import com.bikeway.route.exception.RouteRecordNotFoundException;
import com.bikeway.route.model.domain.CategorizedPath;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reads back route details stored by {@link RouteOptimizerService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteDetailService {

    private final RouteRecordStore routeRecordStore;
    private final ObjectMapper objectMapper;

    public CategorizedPath findRoute(String routeId) {
        String json = routeRecordStore.find(routeId)
                .orElseThrow(() -> new RouteRecordNotFoundException(routeId));
        try {
            return objectMapper.readValue(json, CategorizedPath.class);
        } catch (JsonProcessingException e) {
            log.error("Stored route record {} is unreadable: {}", routeId, e.getMessage());
            throw new IllegalStateException("Stored route record " + routeId + " is unreadable", e);
        }
    }
}
