package com.stlmonitor.collectors.feed;

import java.util.List;

/**
 * Cheap shape check on fetched text. Relays like to answer 200 with their own HTML error page.
 */
public final class FeedContentValidator {
    private static final List<String> FEED_MARKERS = List.of("<rss", "<feed", "<item", "<entry");
    private static final List<String> HTML_MARKERS = List.of("<!DOCTYPE", "<html", "<body");

    private FeedContentValidator() {
    }

    public static boolean isValidFeedContent(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return FEED_MARKERS.stream().anyMatch(text::contains) && !looksLikeHtml(text);
    }

    public static boolean looksLikeHtml(String text) {
        return text != null && HTML_MARKERS.stream().anyMatch(text::contains);
    }
}
