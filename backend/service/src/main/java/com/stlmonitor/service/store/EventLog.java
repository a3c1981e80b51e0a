package com.stlmonitor.service.store;

import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.events.AlertRaised;
import com.stlmonitor.core.events.Event;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes every bus event as one JSON line to the {@code com.stlmonitor.events} logger and keeps the most recent
 * ones in memory for the API.
 */
public class EventLog {
    public static final String LOGGER_NAME = "com.stlmonitor.events";
    public static final int DEFAULT_CAPACITY = 500;

    private static final Logger LOGGER = Logger.getLogger(LOGGER_NAME);

    private final int capacity;
    private final Deque<Event> recent = new ArrayDeque<>();

    public EventLog(EventBus eventBus) {
        this(eventBus, DEFAULT_CAPACITY);
    }

    public EventLog(EventBus eventBus, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        eventBus.subscribeAll(this::append);
    }

    void append(Event event) {
        Level level = event instanceof AlertRaised ? Level.WARNING : Level.INFO;
        if (LOGGER.isLoggable(level)) {
            LOGGER.log(level, EventCodec.toJsonLine(event));
        }
        synchronized (recent) {
            recent.addLast(event);
            while (recent.size() > capacity) {
                recent.removeFirst();
            }
        }
    }

    /**
     * Newest last. Events at or before {@code since} and events of other types are skipped; at most {@code limit}
     * of the newest matches are returned.
     */
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        List<Event> matches = new ArrayList<>();
        synchronized (recent) {
            for (Event event : recent) {
                if (event.timestamp().isAfter(since) && type.map(event.type()::equals).orElse(true)) {
                    matches.add(event);
                }
            }
        }
        int from = Math.max(0, matches.size() - limit);
        return List.copyOf(matches.subList(from, matches.size()));
    }
}
