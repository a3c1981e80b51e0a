package com.stlmonitor.core.model;

public record GeocodeResult(GeoPoint location, ConfidenceLevel confidence, String matchedLocationName) {
}
