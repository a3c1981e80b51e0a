package com.stlmonitor.collectors.news;

import com.stlmonitor.collectors.api.Collector;
import com.stlmonitor.collectors.api.CollectorContext;
import com.stlmonitor.collectors.api.CollectorResult;
import com.stlmonitor.collectors.config.NewsFeedConfig;
import com.stlmonitor.collectors.feed.FeedParser;
import com.stlmonitor.collectors.feed.FeedTransport;
import com.stlmonitor.collectors.feed.RelevanceFilter;
import com.stlmonitor.collectors.feed.SeenUrls;
import com.stlmonitor.core.events.AlertRaised;
import com.stlmonitor.core.events.CollectorTickCompleted;
import com.stlmonitor.core.events.CollectorTickStarted;
import com.stlmonitor.core.events.IncidentsUpdated;
import com.stlmonitor.core.events.NewsIngestionCompleted;
import com.stlmonitor.core.geo.CountyRule;
import com.stlmonitor.core.geo.Gazetteer;
import com.stlmonitor.core.geo.GeoFence;
import com.stlmonitor.core.geo.MetroRegion;
import com.stlmonitor.core.geo.TextGeocoder;
import com.stlmonitor.core.model.ConfidenceLevel;
import com.stlmonitor.core.model.FeedSource;
import com.stlmonitor.core.model.GeocodeResult;
import com.stlmonitor.core.model.Incident;
import com.stlmonitor.core.model.IncidentCategory;
import com.stlmonitor.core.model.IngestionReport;
import com.stlmonitor.core.model.NewsItem;
import com.stlmonitor.core.model.RawFeedItem;
import com.stlmonitor.core.model.SourceStats;
import com.stlmonitor.core.util.HashingUtils;
import com.stlmonitor.core.util.HtmlUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.logging.Logger;

/**
 * Pulls the configured local news feeds, keeps articles that can be placed in the metro with at least medium
 * confidence, and publishes them as news incidents.
 *
 * <p>Sources run concurrently and never fail each other: a source that cannot be fetched contributes no items and
 * a {@code fetched=false} line in the report. Duplicate links are suppressed across sources within one run only.
 */
public class LocalNewsCollector implements Collector {
    public static final String CONFIG_KEY = "localNews";
    public static final int ID_HASH_LENGTH = 12;

    private static final Logger LOGGER = Logger.getLogger(LocalNewsCollector.class.getName());

    private final Gazetteer gazetteer;
    private final Duration interval;
    private final DoubleSupplier random;

    public LocalNewsCollector(Gazetteer gazetteer) {
        this(gazetteer, NewsFeedConfig.DEFAULT_INTERVAL);
    }

    public LocalNewsCollector(Gazetteer gazetteer, Duration interval) {
        this(gazetteer, interval, () -> ThreadLocalRandom.current().nextDouble());
    }

    public LocalNewsCollector(Gazetteer gazetteer, Duration interval, DoubleSupplier random) {
        this.gazetteer = gazetteer;
        this.interval = interval;
        this.random = random;
    }

    @Override
    public String name() {
        return "localNewsCollector";
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
            pipeline = fetchLocalNews(ctx).thenApply(report -> publish(report, ctx));
        } catch (RuntimeException e) {
            pipeline = CompletableFuture.failedFuture(e);
        }

        return pipeline.handle((result, error) -> {
            long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
            if (error != null) {
                ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, durationMillis));
                return CollectorResult.failure("Local news collector failed: " + rootMessage(error), Map.of());
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

    /**
     * Runs one ingestion pass over every configured source. The returned future always completes normally once all
     * sources have settled; per-source failures are folded into the report.
     */
    public CompletableFuture<IngestionReport> fetchLocalNews(CollectorContext ctx) {
        NewsFeedConfig cfg = ctx.requiredConfig(CONFIG_KEY, NewsFeedConfig.class);
        Duration timeout = cfg.requestTimeout() == null ? ctx.requestTimeout() : cfg.requestTimeout();

        RunScope run = new RunScope(
                new FeedTransport(ctx.httpClient(), ctx.eventBus(), ctx.clock(), FeedTransport.routes(cfg.relays()), timeout),
                new FeedParser(ctx.clock()),
                new RelevanceFilter(cfg.keywords(), gazetteer),
                new TextGeocoder(
                        gazetteer,
                        new GeoFence(MetroRegion.ST_LOUIS, ctx.eventBus(), ctx.clock()),
                        CountyRule.JEFFERSON_COUNTY,
                        random,
                        ctx.eventBus(),
                        ctx.clock()
                ),
                new SeenUrls()
        );

        List<CompletableFuture<SourceOutcome>> tasks = cfg.sources().stream()
                .map(source -> safelyIngest(source, run, ctx)
                        .exceptionally(error -> failedOutcome(source, ctx, error)))
                .toList();

        return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> merge(tasks.stream().map(CompletableFuture::join).toList(), cfg, ctx));
    }

    private CompletableFuture<SourceOutcome> safelyIngest(FeedSource source, RunScope run, CollectorContext ctx) {
        try {
            return ingestSource(source, run, ctx);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<SourceOutcome> ingestSource(FeedSource source, RunScope run, CollectorContext ctx) {
        LOGGER.fine(() -> "Fetching " + source.name());
        return run.transport().fetchWithFallbacks(source).thenApply(body -> {
            if (body.isEmpty()) {
                LOGGER.warning(() -> source.name() + ": failed to fetch from all URLs and routes");
                ctx.eventBus().publish(new AlertRaised(
                        ctx.clock().instant(),
                        "collector",
                        "News feed unreachable for " + source.name(),
                        Map.of("collector", name(), "source", source.name(), "url", source.url())
                ));
                return new SourceOutcome(List.of(), SourceStats.notFetched(source.name()));
            }

            List<RawFeedItem> parsed = run.parser().parse(body.get(), source);
            List<NewsItem> items = new ArrayList<>();
            int relevant = 0;
            for (RawFeedItem raw : parsed) {
                if (!run.filter().accept(raw, run.seen())) {
                    continue;
                }
                relevant++;
                Optional<GeocodeResult> geocoded = run.geocoder().geocodeText(raw.title() + " " + raw.description());
                if (geocoded.isEmpty() || geocoded.get().confidence() == ConfidenceLevel.LOW) {
                    continue;
                }
                items.add(toNewsItem(raw, source, geocoded.get()));
            }

            SourceStats stats = new SourceStats(source.name(), true, parsed.size(), relevant, items.size(), null);
            LOGGER.info(() -> source.name() + ": " + items.size() + " items added (" + stats.parsed() + " parsed, "
                    + stats.relevant() + " relevant, " + stats.geocoded() + " geocoded)");
            return new SourceOutcome(items, stats);
        });
    }

    private SourceOutcome failedOutcome(FeedSource source, CollectorContext ctx, Throwable error) {
        String message = rootMessage(error);
        LOGGER.warning(() -> source.name() + ": ingestion failed: " + message);
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "collector",
                "News ingestion failed for " + source.name() + ": " + message,
                Map.of("collector", name(), "source", source.name(), "url", source.url())
        ));
        return new SourceOutcome(List.of(), SourceStats.failed(source.name(), message));
    }

    private IngestionReport merge(List<SourceOutcome> outcomes, NewsFeedConfig cfg, CollectorContext ctx) {
        List<NewsItem> all = new ArrayList<>();
        List<SourceStats> stats = new ArrayList<>();
        for (SourceOutcome outcome : outcomes) {
            all.addAll(outcome.items());
            stats.add(outcome.stats());
        }

        Instant cutoff = ctx.clock().instant().minus(cfg.recencyWindow());
        List<NewsItem> recent = all.stream()
                .sorted(Comparator.comparing(NewsItem::publishedAt).reversed())
                .filter(item -> item.publishedAt().isAfter(cutoff))
                .toList();
        List<NewsItem> returned = recent.stream().limit(cfg.maxItems()).toList();

        int high = countConfidence(returned, ConfidenceLevel.HIGH);
        int medium = countConfidence(returned, ConfidenceLevel.MEDIUM);
        ctx.eventBus().publish(new NewsIngestionCompleted(
                ctx.clock().instant(), stats, all.size(), recent.size(), returned.size(), high, medium));

        for (SourceStats source : stats) {
            if (source.fetched()) {
                LOGGER.info(() -> "  " + source.source() + ": " + source.parsed() + " parsed -> "
                        + source.relevant() + " relevant -> " + source.geocoded() + " geocoded");
            } else {
                LOGGER.info(() -> "  " + source.source() + ": failed to fetch"
                        + (source.error() == null ? "" : " (" + source.error() + ")"));
            }
        }
        LOGGER.info(() -> "News run: " + all.size() + " placed, " + recent.size() + " within "
                + cfg.recencyWindow().toHours() + "h, " + returned.size() + " returned (high " + high
                + ", medium " + medium + ")");
        return new IngestionReport(returned, stats);
    }

    private CollectorResult publish(IngestionReport report, CollectorContext ctx) {
        GeoFence fence = new GeoFence(MetroRegion.ST_LOUIS, ctx.eventBus(), ctx.clock());
        List<Incident> incidents = new NewsIncidentMapper(fence, ctx.clock()).toIncidents(report.items());
        ctx.incidentBoard().replaceNews(report.items());
        ctx.incidentBoard().replaceIncidents(IncidentCategory.NEWS, incidents);
        ctx.eventBus().publish(new IncidentsUpdated(ctx.clock().instant(), IncidentCategory.NEWS, incidents.size()));

        Map<String, Object> stats = new HashMap<>();
        stats.put("sources", report.sources().stream().map(SourceStats::source).toList());
        stats.put("fetchedSources", report.sources().stream().filter(SourceStats::fetched).count());
        stats.put("items", report.items().size());
        stats.put("incidents", incidents.size());
        if (report.allSourcesFetched()) {
            return CollectorResult.success("Local news ingestion completed", stats);
        }
        return CollectorResult.failure("Local news ingestion had failures", stats);
    }

    static NewsItem toNewsItem(RawFeedItem raw, FeedSource source, GeocodeResult geocoded) {
        return new NewsItem(
                newsId(raw.link()),
                raw.title(),
                source.name(),
                raw.link(),
                raw.publishedAt(),
                HtmlUtils.summarize(raw.description()),
                geocoded.location(),
                geocoded.confidence()
        );
    }

    static String newsId(String url) {
        return "news-" + HashingUtils.shortId(url, ID_HASH_LENGTH);
    }

    private static int countConfidence(List<NewsItem> items, ConfidenceLevel level) {
        return (int) items.stream().filter(item -> item.geocodingConfidence() == level).count();
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private record RunScope(
            FeedTransport transport,
            FeedParser parser,
            RelevanceFilter filter,
            TextGeocoder geocoder,
            SeenUrls seen
    ) {
    }

    private record SourceOutcome(List<NewsItem> items, SourceStats stats) {
    }
}
