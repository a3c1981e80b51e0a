package com.stlmonitor.core.model;

/**
 * Gazetteer place kinds, ranked by how precisely a mention pins down a spot on the map.
 */
public enum PlaceType {
    INTERSECTION(20),
    BRIDGE(18),
    LANDMARK(15),
    NEIGHBORHOOD(12),
    CITY(10),
    ROAD(8);

    public static final int UNKNOWN_SCORE = 5;

    private final int specificity;

    PlaceType(int specificity) {
        this.specificity = specificity;
    }

    public int specificity() {
        return specificity;
    }

    public static int scoreOf(PlaceType type) {
        return type == null ? UNKNOWN_SCORE : type.specificity;
    }
}
