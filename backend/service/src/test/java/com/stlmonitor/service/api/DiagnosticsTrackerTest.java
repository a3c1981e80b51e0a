package com.stlmonitor.service.api;

import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.events.AlertRaised;
import com.stlmonitor.core.events.CollectorTickCompleted;
import com.stlmonitor.core.events.CollectorTickStarted;
import com.stlmonitor.core.events.FeedFetchFailed;
import com.stlmonitor.core.events.FeedFetched;
import com.stlmonitor.core.events.IncidentsUpdated;
import com.stlmonitor.core.events.NewsIngestionCompleted;
import com.stlmonitor.core.model.IncidentCategory;
import com.stlmonitor.core.model.SourceStats;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiagnosticsTrackerTest {
    private static final Instant T0 = Instant.parse("2026-02-09T20:00:00Z");

    private final EventBus eventBus = new EventBus((event, error) -> {
        throw new AssertionError("Unexpected bus error", error);
    });
    private final DiagnosticsTracker tracker = new DiagnosticsTracker(eventBus, Clock.fixed(T0, ZoneOffset.UTC));

    @Test
    void tracksCollectorStatusFromTickAndAlertEvents() {
        eventBus.publish(new CollectorTickStarted(T0, "localNewsCollector"));
        eventBus.publish(new AlertRaised(
                T0.plusSeconds(1),
                "collector",
                "News feed unreachable for KSDK News",
                Map.of("collector", "localNewsCollector", "source", "KSDK News")
        ));
        eventBus.publish(new CollectorTickCompleted(T0.plusSeconds(2), "localNewsCollector", false, 321));

        Map<String, Object> metrics = tracker.metricsSnapshot();
        assertEquals(3L, metrics.get("eventsEmittedTotal"));
        assertEquals(3, metrics.get("recentEventsPerMinute"));

        Map<?, ?> collectors = (Map<?, ?>) metrics.get("collectors");
        Map<?, ?> status = (Map<?, ?>) collectors.get("localNewsCollector");
        assertEquals(false, status.get("lastSuccess"));
        assertEquals(321L, status.get("lastDurationMillis"));
        assertEquals("News feed unreachable for KSDK News", status.get("lastErrorMessage"));
    }

    @Test
    void successfulRunClearsThePreviousError() {
        eventBus.publish(new AlertRaised(T0, "collector", "NWS API error: 503", Map.of("collector", "weatherAlertCollector")));
        eventBus.publish(new CollectorTickCompleted(T0.plusSeconds(300), "weatherAlertCollector", true, 40));

        Map<?, ?> status = (Map<?, ?>) tracker.collectorsSnapshot().get("weatherAlertCollector");
        assertEquals(true, status.get("lastSuccess"));
        assertNull(status.get("lastErrorMessage"));
    }

    @Test
    void alertsOutsideTheCollectorCategoryAreIgnored() {
        eventBus.publish(new AlertRaised(T0, "geocoder", "odd", Map.of("collector", "localNewsCollector")));

        assertTrue(tracker.collectorsSnapshot().isEmpty());
    }

    @Test
    void countsFeedRoutesIncidentsAndLastIngestion() {
        eventBus.publish(new FeedFetchFailed(T0, "https://www.ksdk.com/rss/", "direct", FeedFetchFailed.Stage.TIMEOUT, "timed out"));
        eventBus.publish(new FeedFetched(T0, "https://www.ksdk.com/rss/", "allorigins-raw", 2048, 120));
        eventBus.publish(new FeedFetched(T0, "https://fox2now.com/feed/", "direct", 4096, 80));
        eventBus.publish(new IncidentsUpdated(T0, IncidentCategory.NEWS, 7));
        eventBus.publish(new IncidentsUpdated(T0, IncidentCategory.WEATHER, 1));
        eventBus.publish(new NewsIngestionCompleted(
                T0,
                List.of(new SourceStats("KSDK News", true, 20, 8, 5, null), SourceStats.notFetched("Fox 2 Now")),
                20, 15, 12, 4, 3
        ));

        Map<String, Object> metrics = tracker.metricsSnapshot();

        Map<?, ?> routes = (Map<?, ?>) metrics.get("feedRoutes");
        assertEquals(Map.of("fetched", 1L, "failed", 1L), routes.get("direct"));
        assertEquals(Map.of("fetched", 1L, "failed", 0L), routes.get("allorigins-raw"));
        assertEquals(Map.of("news", 7, "weather", 1), metrics.get("incidents"));

        Map<?, ?> ingestion = (Map<?, ?>) metrics.get("lastNewsIngestion");
        assertEquals(2, ingestion.get("sources"));
        assertEquals(1L, ingestion.get("fetchedSources"));
        assertEquals(12, ingestion.get("returned"));
        assertEquals(4, ingestion.get("highConfidence"));
    }

    @Test
    void recentEventsOutsideTheLastMinuteAreDropped() {
        EventBus bus = new EventBus();
        MovingClock clock = new MovingClock(T0);
        DiagnosticsTracker moving = new DiagnosticsTracker(bus, clock);

        bus.publish(new CollectorTickStarted(T0, "localNewsCollector"));
        clock.now = T0.plusSeconds(90);
        bus.publish(new CollectorTickStarted(clock.now, "weatherAlertCollector"));

        Map<String, Object> metrics = moving.metricsSnapshot();
        assertEquals(2L, metrics.get("eventsEmittedTotal"));
        assertEquals(1, metrics.get("recentEventsPerMinute"));
        assertFalse(metrics.containsKey("lastNewsIngestion"));
    }

    private static final class MovingClock extends Clock {
        private Instant now;

        private MovingClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
