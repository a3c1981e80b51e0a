package com.stlmonitor.core.geo;

import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.events.LocationRejected;
import com.stlmonitor.core.model.GeoPoint;

import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Gate that every geocoded coordinate has to pass before it may be shown on the map.
 * Rejections are logged and published as {@link LocationRejected}; nothing here throws.
 */
public class GeoFence {
    private static final Logger LOGGER = Logger.getLogger(GeoFence.class.getName());

    private final MetroRegion region;
    private final EventBus eventBus;
    private final Clock clock;

    public GeoFence(MetroRegion region) {
        this(region, new EventBus(), Clock.systemUTC());
    }

    public GeoFence(MetroRegion region, EventBus eventBus, Clock clock) {
        this.region = Objects.requireNonNull(region, "region is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public MetroRegion region() {
        return region;
    }

    public boolean isWithinBounds(GeoPoint point) {
        boolean within = region.bounds().contains(point);
        if (!within) {
            LOGGER.warning(String.format(Locale.ROOT,
                    "Point (%.4f, %.4f) is outside %s bounds", point.lat(), point.lng(), region.name()));
            eventBus.publish(new LocationRejected(
                    clock.instant(), point.lat(), point.lng(), LocationRejected.OUTSIDE_BOUNDS, null));
        }
        return within;
    }

    public boolean isWithinSubregion(GeoPoint point) {
        return region.subregion().contains(point);
    }

    public double distanceFromCenter(GeoPoint point) {
        return GeoMath.distanceMiles(point, region.center());
    }

    public boolean isValidLocation(GeoPoint point) {
        return isValidLocation(point, region.defaultMaxDistanceMiles());
    }

    public boolean isValidLocation(GeoPoint point, double maxDistanceMiles) {
        if (!isWithinBounds(point)) {
            return false;
        }
        double distance = distanceFromCenter(point);
        if (distance > maxDistanceMiles) {
            LOGGER.warning(String.format(Locale.ROOT,
                    "Location is %.1f miles from %s center (max: %.1fmi)", distance, region.name(), maxDistanceMiles));
            eventBus.publish(new LocationRejected(
                    clock.instant(), point.lat(), point.lng(), LocationRejected.TOO_FAR_FROM_CENTER, distance));
            return false;
        }
        return true;
    }
}
