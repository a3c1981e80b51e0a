package com.stlmonitor.core.model;

public record GeoPoint(double lat, double lng) {
    public GeoPoint withLat(double nextLat) {
        return new GeoPoint(nextLat, lng);
    }
}
