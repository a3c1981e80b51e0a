package com.stlmonitor.core.geo;

import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.events.LocationRejected;
import com.stlmonitor.core.model.GeoBounds;
import com.stlmonitor.core.model.GeoPoint;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoFenceTest {
    private final EventBus bus = new EventBus();
    private final List<LocationRejected> rejections = new CopyOnWriteArrayList<>();
    private final GeoFence fence = new GeoFence(
            MetroRegion.ST_LOUIS,
            bus,
            Clock.fixed(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC)
    );

    GeoFenceTest() {
        bus.subscribe(LocationRejected.class, rejections::add);
    }

    @Test
    void boundsAcceptMetroPointsAndEdges() {
        assertTrue(fence.isWithinBounds(new GeoPoint(38.6270, -90.1994)));
        assertTrue(fence.isWithinBounds(new GeoPoint(39.10, -91.20)));
        assertTrue(fence.isWithinBounds(new GeoPoint(38.20, -89.85)));
        assertTrue(rejections.isEmpty());
    }

    @Test
    void boundsRejectPointsOutsideTheMetroAndPublishReason() {
        assertFalse(fence.isWithinBounds(new GeoPoint(38.7392, -89.6714)));
        assertFalse(fence.isWithinBounds(new GeoPoint(38.1389, -90.5556)));

        assertEquals(2, rejections.size());
        assertEquals(LocationRejected.OUTSIDE_BOUNDS, rejections.get(0).reason());
        assertNull(rejections.get(0).distanceMiles());
    }

    @Test
    void distanceFromCenterUsesHaversineMiles() {
        assertEquals(0.0, fence.distanceFromCenter(MetroRegion.ST_LOUIS.center()), 1e-9);
        // Downtown to Festus is roughly 30 miles.
        double festus = fence.distanceFromCenter(new GeoPoint(38.2206, -90.3958));
        assertTrue(festus > 28 && festus < 32, "unexpected distance " + festus);
    }

    @Test
    void validLocationRequiresBoundsAndRadius() {
        GeoPoint troy = new GeoPoint(38.9792, -90.9807);

        assertTrue(fence.isValidLocation(troy));
        assertFalse(fence.isValidLocation(troy, 10));
        assertEquals(LocationRejected.TOO_FAR_FROM_CENTER, rejections.get(rejections.size() - 1).reason());
        assertTrue(rejections.get(rejections.size() - 1).distanceMiles() > 10);
    }

    @Test
    void radiusCheckCatchesCornersOfTheBox() {
        GeoFence tight = new GeoFence(new MetroRegion(
                "square",
                new GeoPoint(38.6, -90.2),
                new GeoBounds(39.6, 37.6, -89.2, -91.2),
                new GeoBounds(38.65, 38.58, -89.98, -90.15),
                50
        ));

        assertTrue(tight.isWithinBounds(new GeoPoint(39.5, -91.1)));
        assertFalse(tight.isValidLocation(new GeoPoint(39.5, -91.1)));
    }

    @Test
    void subregionOnlyCoversTheCrossRiverCity() {
        assertTrue(fence.isWithinSubregion(new GeoPoint(38.6245, -90.1507)));
        assertFalse(fence.isWithinSubregion(new GeoPoint(38.5201, -89.9840)));
        assertFalse(fence.isWithinSubregion(new GeoPoint(38.6270, -90.1994)));
        assertTrue(rejections.isEmpty());
    }
}
