package com.stlmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IncidentCategory {
    TRAFFIC,
    WEATHER,
    TRANSIT,
    NEWS,
    CRIME;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
