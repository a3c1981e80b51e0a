package com.stlmonitor.core.geo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.stlmonitor.core.model.GazetteerEntry;
import com.stlmonitor.core.util.JsonUtils;

import java.util.List;
import java.util.Locale;

/**
 * Closed list of named places in the metro area. Loaded once and never mutated.
 */
public final class Gazetteer {
    public static final String DEFAULT_RESOURCE = "gazetteer.json";

    private final List<GazetteerEntry> entries;
    private final List<PlaceMatcher> matchers;

    public Gazetteer(List<GazetteerEntry> entries) {
        this.entries = List.copyOf(entries);
        this.matchers = this.entries.stream().map(PlaceMatcher::of).toList();
    }

    public static Gazetteer loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    public static Gazetteer load(String resource) {
        return new Gazetteer(JsonUtils.readResource(resource, new TypeReference<List<GazetteerEntry>>() {
        }));
    }

    public List<GazetteerEntry> entries() {
        return entries;
    }

    /**
     * Compiled once here and shared by every geocoder built over this gazetteer.
     */
    List<PlaceMatcher> matchers() {
        return matchers;
    }

    public int size() {
        return entries.size();
    }

    /**
     * @param lowerText text already lower-cased with {@link Locale#ROOT}
     */
    public boolean mentionsAnyPlace(String lowerText) {
        return matchers.stream().anyMatch(matcher -> matcher.mentionedIn(lowerText));
    }
}
