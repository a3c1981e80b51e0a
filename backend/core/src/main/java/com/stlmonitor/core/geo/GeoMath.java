package com.stlmonitor.core.geo;

import com.stlmonitor.core.model.GeoPoint;

public final class GeoMath {
    public static final double EARTH_RADIUS_MILES = 3959.0;

    private GeoMath() {
    }

    /**
     * Great-circle distance using the haversine formula.
     */
    public static double distanceMiles(GeoPoint a, GeoPoint b) {
        double dLat = Math.toRadians(b.lat() - a.lat());
        double dLng = Math.toRadians(b.lng() - a.lng());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a.lat())) * Math.cos(Math.toRadians(b.lat()))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_MILES * c;
    }
}
