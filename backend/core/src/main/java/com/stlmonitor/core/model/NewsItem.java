package com.stlmonitor.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A local news article. When {@code location} is set it has already passed the geographic fence and
 * {@code geocodingConfidence} is set with it.
 */
public record NewsItem(
        String id,
        String title,
        String outlet,
        String url,
        Instant publishedAt,
        String snippet,
        GeoPoint location,
        ConfidenceLevel geocodingConfidence
) {
    public NewsItem {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(publishedAt, "publishedAt is required");
        if (location != null && geocodingConfidence == null) {
            throw new IllegalArgumentException("geocodingConfidence is required when location is present");
        }
    }

    public boolean isPlaced() {
        return location != null;
    }
}
