package com.stlmonitor.core.model;

import java.time.Instant;

public record WeatherAlert(
        String id,
        String event,
        String headline,
        String description,
        String severity,
        String urgency,
        GeoPolygon polygon,
        Instant effective,
        Instant expires
) {
}
