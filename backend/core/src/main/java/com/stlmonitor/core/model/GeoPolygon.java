package com.stlmonitor.core.model;

import java.util.List;

/**
 * GeoJSON polygon as delivered by the weather service: rings of [lng, lat] pairs.
 */
public record GeoPolygon(String type, List<List<List<Double>>> coordinates) {
    public GeoPolygon {
        coordinates = coordinates == null ? List.of() : List.copyOf(coordinates);
    }
}
