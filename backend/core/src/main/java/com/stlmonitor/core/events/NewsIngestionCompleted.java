package com.stlmonitor.core.events;

import com.stlmonitor.core.model.SourceStats;

import java.time.Instant;
import java.util.List;

public record NewsIngestionCompleted(
        Instant timestamp,
        List<SourceStats> sources,
        int totalItems,
        int withinWindow,
        int returned,
        int highConfidence,
        int mediumConfidence
) implements Event {
    @Override
    public String type() {
        return "NewsIngestionCompleted";
    }
}
