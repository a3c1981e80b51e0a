package com.stlmonitor.collectors.config;

import com.stlmonitor.collectors.feed.RelevanceFilter;
import com.stlmonitor.core.model.FeedSource;

import java.time.Duration;
import java.util.List;

/**
 * Settings for one local news ingestion run. Omitted fields fall back to the defaults below; {@code requestTimeout}
 * may stay null, in which case the collector context timeout applies.
 */
public record NewsFeedConfig(
        Duration interval,
        Duration requestTimeout,
        Duration recencyWindow,
        int maxItems,
        List<String> keywords,
        List<FeedSource> sources,
        List<RelayConfig> relays
) {
    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_RECENCY_WINDOW = Duration.ofHours(48);
    public static final int DEFAULT_MAX_ITEMS = 100;

    public NewsFeedConfig {
        interval = interval == null ? DEFAULT_INTERVAL : interval;
        recencyWindow = recencyWindow == null ? DEFAULT_RECENCY_WINDOW : recencyWindow;
        maxItems = maxItems <= 0 ? DEFAULT_MAX_ITEMS : maxItems;
        keywords = keywords == null ? RelevanceFilter.DEFAULT_KEYWORDS : List.copyOf(keywords);
        sources = sources == null ? List.of() : List.copyOf(sources);
        relays = relays == null ? RelayConfig.DEFAULTS : List.copyOf(relays);
    }

    public static NewsFeedConfig withSources(List<FeedSource> sources) {
        return new NewsFeedConfig(null, null, null, 0, null, sources, null);
    }
}
