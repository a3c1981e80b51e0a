package com.stlmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IncidentStatus {
    ACTIVE,
    RESOLVING,
    CLEARED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
