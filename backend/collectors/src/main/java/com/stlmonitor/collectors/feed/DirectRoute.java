package com.stlmonitor.collectors.feed;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;

public final class DirectRoute implements FetchRoute {
    public static final String NAME = "direct";
    public static final String FEED_ACCEPT = "application/rss+xml, application/xml, text/xml, */*";
    public static final String USER_AGENT = "Mozilla/5.0 (compatible; STLMonitor/1.0)";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public HttpRequest request(String targetUrl, Duration timeout) {
        return HttpRequest.newBuilder(URI.create(targetUrl))
                .GET()
                .timeout(timeout)
                .header("Accept", FEED_ACCEPT)
                .header("User-Agent", USER_AGENT)
                .build();
    }
}
