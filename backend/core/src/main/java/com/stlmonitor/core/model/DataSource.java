package com.stlmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DataSource {
    MODOT("MoDOT"),
    IDOT("IDOT (East St. Louis Only)"),
    NWS("NWS"),
    METRO_TRANSIT("Metro Transit"),
    SLMPD("SLMPD"),
    STL_COUNTY("STL County"),
    LOCAL_NEWS("Local News");

    private final String label;

    DataSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
