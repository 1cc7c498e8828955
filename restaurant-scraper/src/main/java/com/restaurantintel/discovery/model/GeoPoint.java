package com.restaurantintel.discovery.model;

/**
 * A WGS84 latitude/longitude pair. Used for zone centres and planner scan points.
 */
public record GeoPoint(double latitude, double longitude) {

    @Override
    public String toString() {
        return String.format("(%.6f, %.6f)", latitude, longitude);
    }
}
