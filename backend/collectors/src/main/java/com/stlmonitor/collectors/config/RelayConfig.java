package com.stlmonitor.collectors.config;

import com.stlmonitor.collectors.feed.Envelope;

import java.util.List;
import java.util.Objects;

/**
 * A public pass-through proxy. The target feed URL is URL-encoded and appended to {@code prefix}.
 */
public record RelayConfig(String name, String prefix, Envelope envelope) {
    public static final List<RelayConfig> DEFAULTS = List.of(
            new RelayConfig("allorigins-raw", "https://api.allorigins.win/raw?url=", Envelope.RAW),
            new RelayConfig("allorigins-get", "https://api.allorigins.win/get?url=", Envelope.JSON),
            new RelayConfig("corsproxy", "https://corsproxy.io/?", Envelope.RAW),
            new RelayConfig("codetabs", "https://api.codetabs.com/v1/proxy?quest=", Envelope.RAW),
            new RelayConfig("thingproxy", "https://thingproxy.freeboard.io/fetch/", Envelope.RAW)
    );

    public RelayConfig {
        Objects.requireNonNull(prefix, "prefix is required");
        name = name == null || name.isBlank() ? prefix : name;
        envelope = envelope == null ? Envelope.RAW : envelope;
    }
}
