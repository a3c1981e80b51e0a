package com.stlmonitor.core.events;

import java.time.Instant;

/**
 * A coordinate failed the geographic fence.
 *
 * @param reason {@code outside_bounds} or {@code too_far_from_center}
 * @param distanceMiles distance from the metro centre, or {@code null} when the bounds check already failed
 */
public record LocationRejected(
        Instant timestamp,
        double lat,
        double lng,
        String reason,
        Double distanceMiles
) implements Event {
    public static final String OUTSIDE_BOUNDS = "outside_bounds";
    public static final String TOO_FAR_FROM_CENTER = "too_far_from_center";

    @Override
    public String type() {
        return "LocationRejected";
    }
}
