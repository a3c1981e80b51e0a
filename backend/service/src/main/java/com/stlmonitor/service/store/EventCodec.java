package com.stlmonitor.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stlmonitor.core.events.Event;
import com.stlmonitor.core.util.JsonUtils;

import java.time.Instant;

/**
 * JSON line form of bus events: {@code {"type":..., "timestamp":..., "event":{...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private EventCodec() {
    }

    public static StoredEvent wrap(Event event) {
        return new StoredEvent(event.type(), event.timestamp(), event);
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(wrap(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
