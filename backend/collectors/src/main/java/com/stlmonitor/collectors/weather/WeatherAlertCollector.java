package com.stlmonitor.collectors.weather;

import com.stlmonitor.collectors.api.Collector;
import com.stlmonitor.collectors.api.CollectorContext;
import com.stlmonitor.collectors.api.CollectorResult;
import com.stlmonitor.collectors.config.WeatherAlertConfig;
import com.stlmonitor.core.events.AlertRaised;
import com.stlmonitor.core.events.CollectorTickCompleted;
import com.stlmonitor.core.events.CollectorTickStarted;
import com.stlmonitor.core.events.IncidentsUpdated;
import com.stlmonitor.core.geo.MetroRegion;
import com.stlmonitor.core.model.Incident;
import com.stlmonitor.core.model.IncidentCategory;
import com.stlmonitor.core.model.WeatherAlert;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

public class WeatherAlertCollector implements Collector {
    public static final String CONFIG_KEY = "weatherAlerts";

    private static final Logger LOGGER = Logger.getLogger(WeatherAlertCollector.class.getName());

    private final Duration interval;

    public WeatherAlertCollector() {
        this(Duration.ofMinutes(5));
    }

    public WeatherAlertCollector(Duration interval) {
        this.interval = interval;
    }

    @Override
    public String name() {
        return "weatherAlertCollector";
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant tickStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(tickStartedAt, name()));

        CompletableFuture<CollectorResult> pipeline;
        try {
            WeatherAlertConfig cfg = ctx.requiredConfig(CONFIG_KEY, WeatherAlertConfig.class);
            pipeline = new NwsAlertClient(ctx.httpClient(), ctx.requestTimeout())
                    .fetchActiveAlerts(cfg)
                    .thenApply(alerts -> publish(alerts, ctx));
        } catch (RuntimeException e) {
            pipeline = CompletableFuture.failedFuture(e);
        }

        return pipeline.handle((result, error) -> {
            long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
            if (error != null) {
                String message = rootMessage(error);
                LOGGER.warning(() -> "Failed to fetch NWS alerts: " + message);
                ctx.eventBus().publish(new AlertRaised(
                        ctx.clock().instant(),
                        "collector",
                        "NWS alert fetch failed: " + message,
                        Map.of("collector", name())
                ));
                ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, durationMillis));
                return CollectorResult.failure("Weather alert collector failed: " + message, Map.of());
            }
            ctx.eventBus().publish(new CollectorTickCompleted(
                    ctx.clock().instant(),
                    name(),
                    result.success(),
                    durationMillis
            ));
            return result;
        });
    }

    private CollectorResult publish(List<WeatherAlert> alerts, CollectorContext ctx) {
        List<Incident> incidents = new WeatherAlertMapper(MetroRegion.ST_LOUIS, ctx.clock()).toIncidents(alerts);
        ctx.incidentBoard().replaceIncidents(IncidentCategory.WEATHER, incidents);
        ctx.eventBus().publish(new IncidentsUpdated(ctx.clock().instant(), IncidentCategory.WEATHER, incidents.size()));
        LOGGER.info(() -> "NWS: " + incidents.size() + " active alert(s) for the metro");
        return CollectorResult.success("Weather alerts refreshed", Map.of("alerts", incidents.size()));
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
