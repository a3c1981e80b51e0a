package com.stlmonitor.core.model;

import java.time.Instant;

public record Camera(
        String id,
        String name,
        CameraProvider provider,
        GeoPoint location,
        String thumbnailUrl,
        String streamUrl,
        String roadway,
        Instant lastOkAt,
        int failCount,
        boolean stale
) {
}
