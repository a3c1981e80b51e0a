package com.stlmonitor.core.model;

/**
 * Latitude/longitude rectangle, edges inclusive.
 */
public record GeoBounds(double north, double south, double east, double west) {
    public GeoBounds {
        if (south > north) {
            throw new IllegalArgumentException("south must not exceed north");
        }
        if (west > east) {
            throw new IllegalArgumentException("west must not exceed east");
        }
    }

    public boolean contains(GeoPoint point) {
        return point.lat() >= south
                && point.lat() <= north
                && point.lng() >= west
                && point.lng() <= east;
    }
}
