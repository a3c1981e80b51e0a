package com.stlmonitor.core.model;

import java.util.List;
import java.util.Objects;

public record GazetteerEntry(
        String name,
        List<String> aliases,
        GeoPoint location,
        PlaceType type
) {
    public GazetteerEntry {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(location, "location is required");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
