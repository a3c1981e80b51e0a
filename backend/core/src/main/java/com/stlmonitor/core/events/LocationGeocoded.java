package com.stlmonitor.core.events;

import com.stlmonitor.core.model.ConfidenceLevel;
import com.stlmonitor.core.model.PlaceType;

import java.time.Instant;

public record LocationGeocoded(
        Instant timestamp,
        String matchedLocationName,
        PlaceType placeType,
        int score,
        ConfidenceLevel confidence,
        double lat,
        double lng,
        boolean countyPreferred
) implements Event {
    @Override
    public String type() {
        return "LocationGeocoded";
    }
}
