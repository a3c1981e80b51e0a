package com.stlmonitor.collectors.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.stlmonitor.collectors.config.RelayConfig;
import com.stlmonitor.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class RelayRoute implements FetchRoute {
    private final RelayConfig relay;

    public RelayRoute(RelayConfig relay) {
        this.relay = relay;
    }

    @Override
    public String name() {
        return relay.name();
    }

    @Override
    public HttpRequest request(String targetUrl, Duration timeout) {
        String accept = relay.envelope() == Envelope.JSON ? "application/json" : DirectRoute.FEED_ACCEPT;
        return HttpRequest.newBuilder(URI.create(relay.prefix() + URLEncoder.encode(targetUrl, StandardCharsets.UTF_8)))
                .GET()
                .timeout(timeout)
                .header("Accept", accept)
                .build();
    }

    @Override
    public String unwrap(String responseBody) throws IOException {
        if (relay.envelope() == Envelope.RAW) {
            return responseBody;
        }
        JsonNode root = JsonUtils.objectMapper().readTree(responseBody);
        if (root == null || !root.isObject()) {
            throw new IOException("Relay " + relay.name() + " did not return a JSON object");
        }
        String contents = root.path("contents").asText("");
        return contents.isEmpty() ? root.path("content").asText("") : contents;
    }
}
