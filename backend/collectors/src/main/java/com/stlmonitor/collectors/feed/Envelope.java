package com.stlmonitor.collectors.feed;

/**
 * How a relay hands back the feed body.
 */
public enum Envelope {
    /** The response body is the feed itself. */
    RAW,
    /** The feed arrives as a string field of a JSON object, {@code contents} or {@code content}. */
    JSON
}
