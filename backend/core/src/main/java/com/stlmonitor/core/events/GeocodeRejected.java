package com.stlmonitor.core.events;

import java.time.Instant;

/**
 * Text could not be placed on the map. {@code matchedLocationName} is null when nothing in the gazetteer matched.
 */
public record GeocodeRejected(
        Instant timestamp,
        String reason,
        String matchedLocationName,
        int score
) implements Event {
    public static final String NO_MATCH = "no_match";
    public static final String LOW_SCORE = "low_score";
    public static final String FENCE_REJECTED = "fence_rejected";

    @Override
    public String type() {
        return "GeocodeRejected";
    }
}
