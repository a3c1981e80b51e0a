package com.stlmonitor.collectors.feed;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Article links already handled in the current ingestion run. Source tasks share one instance; separate runs never do.
 */
public final class SeenUrls {
    private final Set<String> links = ConcurrentHashMap.newKeySet();

    /**
     * Records {@code link} and reports whether this was the first time it was seen in the run.
     */
    public boolean firstSighting(String link) {
        return links.add(link);
    }

    public int size() {
        return links.size();
    }
}
