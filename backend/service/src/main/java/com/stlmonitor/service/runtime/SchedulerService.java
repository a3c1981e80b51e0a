package com.stlmonitor.service.runtime;

import com.stlmonitor.collectors.api.Collector;
import com.stlmonitor.collectors.api.CollectorContext;
import com.stlmonitor.collectors.api.CollectorResult;
import com.stlmonitor.core.events.AlertRaised;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs each enabled collector on its own fixed-rate timer. A tick that fires while the previous run of the same
 * collector is still in flight is skipped.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final List<ScheduledCollector> collectors;
    private final CollectorContext context;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor =
            Executors.newSingleThreadScheduledExecutor(daemonThreads("collector-timer"));
    private final ExecutorService collectorExecutor = Executors.newCachedThreadPool(daemonThreads("collector-run"));
    private final Map<String, Boolean> inFlight = new ConcurrentHashMap<>();

    public SchedulerService(List<ScheduledCollector> collectors, CollectorContext context) {
        this(collectors, context, 1_000);
    }

    SchedulerService(List<ScheduledCollector> collectors, CollectorContext context, long minIntervalMillis) {
        this.collectors = List.copyOf(collectors);
        this.context = context;
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        for (ScheduledCollector scheduled : collectors) {
            if (!scheduled.enabled()) {
                LOGGER.info(() -> scheduled.collector().name() + " is disabled");
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> collectorExecutor.execute(() -> runIfIdle(scheduled.collector())),
                    0,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
            LOGGER.info(() -> "Scheduled " + scheduled.collector().name() + " every " + intervalMillis + "ms");
        }
    }

    /**
     * Runs every enabled collector once, concurrently, and waits for all of them to settle.
     */
    public List<CollectorResult> runOnceAllCollectors() {
        List<CompletableFuture<CollectorResult>> runs = collectors.stream()
                .filter(ScheduledCollector::enabled)
                .map(scheduled -> CompletableFuture.supplyAsync(
                        () -> runCollectorSafely(scheduled.collector()),
                        collectorExecutor
                ))
                .toList();
        CompletableFuture.allOf(runs.toArray(CompletableFuture[]::new)).join();
        return runs.stream().map(CompletableFuture::join).toList();
    }

    public void shutdown() {
        timerExecutor.shutdown();
        collectorExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            collectorExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public List<ScheduledCollector> scheduledCollectors() {
        return collectors;
    }

    private void runIfIdle(Collector collector) {
        if (inFlight.putIfAbsent(collector.name(), Boolean.TRUE) != null) {
            LOGGER.fine(() -> collector.name() + " is still running, skipping tick");
            return;
        }
        try {
            runCollectorSafely(collector);
        } finally {
            inFlight.remove(collector.name());
        }
    }

    private CollectorResult runCollectorSafely(Collector collector) {
        try {
            CollectorResult result = collector.poll(context).join();
            LOGGER.fine(() -> collector.name() + ": " + result.message());
            return result;
        } catch (Exception ex) {
            LOGGER.log(Level.WARNING, "Collector run failed: " + collector.name(), ex);
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    "collector",
                    "Collector run failed: " + collector.name() + " - " + rootMessage(ex),
                    Map.of("collector", collector.name())
            ));
            return CollectorResult.failure(
                    "Collector run failed: " + collector.name(),
                    Map.of("collector", collector.name())
            );
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record ScheduledCollector(Collector collector, Duration interval, boolean enabled) {
        public ScheduledCollector {
            Objects.requireNonNull(collector, "collector is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }
}
