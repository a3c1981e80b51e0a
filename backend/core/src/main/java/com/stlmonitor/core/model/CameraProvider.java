package com.stlmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CameraProvider {
    MODOT("MoDOT"),
    IDOT("IDOT"),
    STL_CITY("STL City"),
    OTHER("Other");

    private final String label;

    CameraProvider(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
