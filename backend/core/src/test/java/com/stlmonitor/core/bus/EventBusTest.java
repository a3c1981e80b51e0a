package com.stlmonitor.core.bus;

import com.stlmonitor.core.events.CollectorTickStarted;
import com.stlmonitor.core.events.Event;
import com.stlmonitor.core.events.GeocodeRejected;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> hitsA.incrementAndGet());
        bus.subscribe(CollectorTickStarted.class, event -> hitsB.incrementAndGet());

        bus.publish(new CollectorTickStarted(Instant.parse("2026-01-01T00:00:00Z"), "localNewsCollector"));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventType() {
        EventBus bus = new EventBus();
        AtomicInteger tickHits = new AtomicInteger();
        AtomicInteger rejectHits = new AtomicInteger();

        bus.subscribe(CollectorTickStarted.class, event -> tickHits.incrementAndGet());
        bus.subscribe(GeocodeRejected.class, event -> rejectHits.incrementAndGet());

        bus.publish(new CollectorTickStarted(Instant.parse("2026-01-01T00:00:00Z"), "localNewsCollector"));
        bus.publish(new GeocodeRejected(Instant.parse("2026-01-01T00:00:01Z"), GeocodeRejected.NO_MATCH, null, 0));

        assertEquals(1, tickHits.get());
        assertEquals(1, rejectHits.get());
    }

    @Test
    void wildcardSubscribersSeeEveryEventAfterTypedSubscribers() {
        EventBus bus = new EventBus();
        List<String> order = new CopyOnWriteArrayList<>();

        bus.subscribeAll(event -> order.add("all:" + event.type()));
        bus.subscribe(CollectorTickStarted.class, event -> order.add("typed"));

        bus.publish(new CollectorTickStarted(Instant.parse("2026-01-01T00:00:00Z"), "weatherAlertCollector"));
        bus.publish(new GeocodeRejected(Instant.parse("2026-01-01T00:00:01Z"), GeocodeRejected.LOW_SCORE, "Soulard", 9));

        assertEquals(List.of("typed", "all:CollectorTickStarted", "all:GeocodeRejected"), order);
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> capturedError.set(error));
        AtomicInteger safeHits = new AtomicInteger();
        List<Event> everything = new CopyOnWriteArrayList<>();

        bus.subscribe(CollectorTickStarted.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(CollectorTickStarted.class, event -> safeHits.incrementAndGet());
        bus.subscribeAll(everything::add);

        bus.publish(new CollectorTickStarted(Instant.parse("2026-01-01T00:00:00Z"), "localNewsCollector"));

        assertEquals(1, safeHits.get());
        assertEquals(1, everything.size());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
    }
}
