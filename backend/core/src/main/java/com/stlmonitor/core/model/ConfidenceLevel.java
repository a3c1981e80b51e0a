package com.stlmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
