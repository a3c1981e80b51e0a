package com.stlmonitor.core.model;

/**
 * Per-source counters for one ingestion run. {@code error} is null unless the source task itself blew up.
 */
public record SourceStats(
        String source,
        boolean fetched,
        int parsed,
        int relevant,
        int geocoded,
        String error
) {
    public static SourceStats notFetched(String source) {
        return new SourceStats(source, false, 0, 0, 0, null);
    }

    public static SourceStats failed(String source, String error) {
        return new SourceStats(source, false, 0, 0, 0, error);
    }
}
