package com.stlmonitor.core.model;

import java.time.Instant;

public record RawFeedItem(
        String title,
        String link,
        String description,
        Instant publishedAt
) {
}
