package com.bikeway.route.cache;

import java.util.Optional;

/**
 * Short-lived key-value store for serialized route details. Entries are write-once and expire on their own.
 */
public interface RouteRecordStore {

    void save(String routeId, String json);

    /**
     * Empty when the record was never written or has expired.
     */
    Optional<String> find(String routeId);
}
