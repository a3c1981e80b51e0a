package com.stlmonitor.core.events;

import java.time.Instant;

/**
 * One route of the transport chain failed for a feed URL. Further routes may still succeed.
 */
public record FeedFetchFailed(
        Instant timestamp,
        String url,
        String route,
        Stage stage,
        String detail
) implements Event {
    public enum Stage {
        TIMEOUT,
        HTTP_STATUS,
        HTML_PAGE,
        INVALID_CONTENT,
        ERROR
    }

    @Override
    public String type() {
        return "FeedFetchFailed";
    }
}
