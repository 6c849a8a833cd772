package com.bikeway.route.model.domain;

/**
 * WGS84 point. Range checks happen at the HTTP boundary.
 */
public record Coordinate(double lat, double lng) {

    /**
     * Engine wire order.
     */
    public double[] toLngLat() {
        return new double[]{lng, lat};
    }
}
