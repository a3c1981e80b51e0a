package com.stlmonitor.core.geo;

import com.stlmonitor.core.model.Camera;
import com.stlmonitor.core.model.CameraProvider;
import com.stlmonitor.core.model.DataSource;
import com.stlmonitor.core.model.Incident;

import java.util.Comparator;
import java.util.List;

public final class CameraLocator {
    public static final double DEFAULT_RADIUS_MILES = 0.5;
    public static final int DEFAULT_MAX_RESULTS = 3;

    private CameraLocator() {
    }

    public static List<Camera> findNearby(Incident incident, List<Camera> cameras) {
        return findNearby(incident, cameras, DEFAULT_RADIUS_MILES, DEFAULT_MAX_RESULTS);
    }

    /**
     * Cameras within {@code radiusMiles} of the incident, cameras run by the incident's own agency first, then
     * nearest first.
     */
    public static List<Camera> findNearby(Incident incident, List<Camera> cameras, double radiusMiles, int maxResults) {
        return cameras.stream()
                .map(camera -> new Ranked(camera, GeoMath.distanceMiles(incident.location(), camera.location())))
                .filter(ranked -> ranked.distance() <= radiusMiles)
                .sorted(Comparator.comparing((Ranked ranked) -> !matchesProvider(incident, ranked.camera()))
                        .thenComparingDouble(Ranked::distance))
                .limit(Math.max(0, maxResults))
                .map(Ranked::camera)
                .toList();
    }

    static boolean matchesProvider(Incident incident, Camera camera) {
        if (incident.source() == DataSource.MODOT && camera.provider() == CameraProvider.MODOT) {
            return true;
        }
        return incident.source() == DataSource.IDOT && camera.provider() == CameraProvider.IDOT;
    }

    private record Ranked(Camera camera, double distance) {
    }
}
