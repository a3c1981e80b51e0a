package com.stlmonitor.core.geo;

import com.stlmonitor.core.model.GeoBounds;
import com.stlmonitor.core.model.GeoPoint;

/**
 * The area every produced coordinate must fall into.
 *
 * @param subregion the restricted cross-river area where only one city is valid
 */
public record MetroRegion(
        String name,
        GeoPoint center,
        GeoBounds bounds,
        GeoBounds subregion,
        double defaultMaxDistanceMiles
) {
    // North reaches Lincoln County, south Jefferson County, west Franklin/Warren County; east stops at the
    // Illinois suburbs.
    public static final MetroRegion ST_LOUIS = new MetroRegion(
            "Greater St. Louis",
            new GeoPoint(38.6270, -90.1994),
            new GeoBounds(39.10, 38.20, -89.85, -91.20),
            new GeoBounds(38.65, 38.58, -89.98, -90.15),
            50.0
    );
}
