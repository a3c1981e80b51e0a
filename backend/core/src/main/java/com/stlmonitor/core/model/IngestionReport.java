package com.stlmonitor.core.model;

import java.util.List;

public record IngestionReport(List<NewsItem> items, List<SourceStats> sources) {
    public IngestionReport {
        items = List.copyOf(items);
        sources = List.copyOf(sources);
    }

    public boolean allSourcesFetched() {
        return sources.stream().allMatch(SourceStats::fetched);
    }
}
