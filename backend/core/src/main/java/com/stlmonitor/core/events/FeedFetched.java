package com.stlmonitor.core.events;

import java.time.Instant;

public record FeedFetched(
        Instant timestamp,
        String url,
        String route,
        int bodyLength,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "FeedFetched";
    }
}
