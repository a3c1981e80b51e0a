package com.stlmonitor.collectors.feed;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * One way of reaching a feed URL: straight at the publisher, or through a relay.
 */
public interface FetchRoute {
    String name();

    HttpRequest request(String targetUrl, Duration timeout);

    /**
     * Pulls the feed text out of a successful response body.
     *
     * @throws IOException when the body is not in the shape this route expects
     */
    default String unwrap(String responseBody) throws IOException {
        return responseBody;
    }
}
