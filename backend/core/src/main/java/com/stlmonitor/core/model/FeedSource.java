package com.stlmonitor.core.model;

import java.util.List;
import java.util.Objects;

public record FeedSource(
        String name,
        String url,
        List<String> fallbackUrls,
        FeedDialect dialect
) {
    public FeedSource {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(url, "url is required");
        fallbackUrls = fallbackUrls == null ? List.of() : List.copyOf(fallbackUrls);
        dialect = dialect == null ? FeedDialect.RSS : dialect;
    }

    public FeedSource(String name, String url) {
        this(name, url, List.of(), FeedDialect.RSS);
    }
}
