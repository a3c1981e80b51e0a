package com.stlmonitor.core.model;

import java.time.Instant;
import java.util.Objects;

public record Incident(
        String id,
        String title,
        String description,
        IncidentCategory category,
        String subtype,
        int severity,
        ConfidenceLevel confidence,
        IncidentStatus status,
        GeoPoint location,
        GeoPolygon polygon,
        DataSource source,
        String sourceUrl,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt
) {
    public Incident {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(location, "location is required");
        if (severity < 0 || severity > 100) {
            throw new IllegalArgumentException("severity must be within 0-100");
        }
    }
}
