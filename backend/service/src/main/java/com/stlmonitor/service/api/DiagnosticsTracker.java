package com.stlmonitor.service.api;

import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.events.AlertRaised;
import com.stlmonitor.core.events.CollectorTickCompleted;
import com.stlmonitor.core.events.CollectorTickStarted;
import com.stlmonitor.core.events.Event;
import com.stlmonitor.core.events.FeedFetchFailed;
import com.stlmonitor.core.events.FeedFetched;
import com.stlmonitor.core.events.IncidentsUpdated;
import com.stlmonitor.core.events.NewsIngestionCompleted;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Folds bus events into the counters served by {@code /api/metrics}: event throughput, per-collector run status,
 * per-route feed fetch outcomes, current incident counts and the last news ingestion summary.
 */
public final class DiagnosticsTracker {
    private final Clock clock;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, CollectorStatus> collectorStatuses = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RouteCounters> routes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Integer> incidentCounts = new ConcurrentHashMap<>();
    private final AtomicReference<NewsIngestionCompleted> lastIngestion = new AtomicReference<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock) {
        this.clock = clock;
        eventBus.subscribeAll(this::onAnyEvent);
        eventBus.subscribe(CollectorTickStarted.class, this::onTickStarted);
        eventBus.subscribe(CollectorTickCompleted.class, this::onTickCompleted);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
        eventBus.subscribe(FeedFetched.class, event -> route(event.route()).fetched.increment());
        eventBus.subscribe(FeedFetchFailed.class, event -> route(event.route()).failed.increment());
        eventBus.subscribe(IncidentsUpdated.class,
                event -> incidentCounts.put(event.category().wireName(), event.incidentCount()));
        eventBus.subscribe(NewsIngestionCompleted.class, lastIngestion::set);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("collectors", collectorsSnapshot());
        metrics.put("feedRoutes", routesSnapshot());
        metrics.put("incidents", new TreeMap<>(incidentCounts));
        NewsIngestionCompleted ingestion = lastIngestion.get();
        if (ingestion != null) {
            metrics.put("lastNewsIngestion", ingestionSummary(ingestion));
        }
        return metrics;
    }

    public Map<String, Object> collectorsSnapshot() {
        Map<String, Object> collectors = new TreeMap<>();
        for (Map.Entry<String, CollectorStatus> entry : collectorStatuses.entrySet()) {
            collectors.put(entry.getKey(), entry.getValue().toMap());
        }
        return collectors;
    }

    private Map<String, Object> routesSnapshot() {
        Map<String, Object> snapshot = new TreeMap<>();
        routes.forEach((name, counters) -> snapshot.put(name, Map.of(
                "fetched", counters.fetched.longValue(),
                "failed", counters.failed.longValue()
        )));
        return snapshot;
    }

    private static Map<String, Object> ingestionSummary(NewsIngestionCompleted event) {
        Map<String, Object> summary = new HashMap<>();
        summary.put("completedAt", event.timestamp().toString());
        summary.put("sources", event.sources().size());
        summary.put("fetchedSources", event.sources().stream().filter(source -> source.fetched()).count());
        summary.put("totalItems", event.totalItems());
        summary.put("withinWindow", event.withinWindow());
        summary.put("returned", event.returned());
        summary.put("highConfidence", event.highConfidence());
        summary.put("mediumConfidence", event.mediumConfidence());
        return summary;
    }

    private RouteCounters route(String name) {
        return routes.computeIfAbsent(name, ignored -> new RouteCounters());
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty() && recentEventTimestamps.peekFirst().isBefore(threshold)) {
            recentEventTimestamps.removeFirst();
        }
    }

    private void onTickStarted(CollectorTickStarted event) {
        collectorStatuses.compute(event.collectorName(),
                (name, current) -> orEmpty(current).withLastRunAt(event.timestamp()));
    }

    private void onTickCompleted(CollectorTickCompleted event) {
        collectorStatuses.compute(event.collectorName(), (name, current) ->
                orEmpty(current).withCompletion(event.timestamp(), event.durationMillis(), event.success()));
    }

    private void onAlertRaised(AlertRaised event) {
        if (!"collector".equalsIgnoreCase(event.category()) || event.details() == null) {
            return;
        }
        Object collector = event.details().get("collector");
        if (!(collector instanceof String collectorName) || collectorName.isBlank()) {
            return;
        }
        collectorStatuses.compute(collectorName,
                (name, current) -> orEmpty(current).withLastErrorMessage(event.message()));
    }

    private static CollectorStatus orEmpty(CollectorStatus status) {
        return status == null ? new CollectorStatus(null, null, null, null) : status;
    }

    private static final class RouteCounters {
        private final LongAdder fetched = new LongAdder();
        private final LongAdder failed = new LongAdder();
    }

    // lastErrorMessage survives a failed completion and is cleared by a successful one.
    private record CollectorStatus(
            Instant lastRunAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            String lastErrorMessage
    ) {
        private CollectorStatus withLastRunAt(Instant runAt) {
            return new CollectorStatus(runAt, lastDurationMillis, lastSuccess, lastErrorMessage);
        }

        private CollectorStatus withCompletion(Instant completedAt, long durationMillis, boolean success) {
            return new CollectorStatus(completedAt, durationMillis, success, success ? null : lastErrorMessage);
        }

        private CollectorStatus withLastErrorMessage(String message) {
            return new CollectorStatus(lastRunAt, lastDurationMillis, lastSuccess, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
