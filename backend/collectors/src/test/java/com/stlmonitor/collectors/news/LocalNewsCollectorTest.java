package com.stlmonitor.collectors.news;

import com.stlmonitor.collectors.api.CollectorContext;
import com.stlmonitor.collectors.api.CollectorResult;
import com.stlmonitor.collectors.config.NewsFeedConfig;
import com.stlmonitor.collectors.config.RelayConfig;
import com.stlmonitor.collectors.feed.Envelope;
import com.stlmonitor.collectors.feed.RelevanceFilter;
import com.stlmonitor.collectors.support.EventCapture;
import com.stlmonitor.collectors.support.FeedServer;
import com.stlmonitor.collectors.support.FixtureUtils;
import com.stlmonitor.collectors.support.InMemoryIncidentBoard;
import com.stlmonitor.collectors.support.MutableClock;
import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.events.AlertRaised;
import com.stlmonitor.core.events.IncidentsUpdated;
import com.stlmonitor.core.events.NewsIngestionCompleted;
import com.stlmonitor.core.geo.Gazetteer;
import com.stlmonitor.core.model.ConfidenceLevel;
import com.stlmonitor.core.model.FeedDialect;
import com.stlmonitor.core.model.FeedSource;
import com.stlmonitor.core.model.GeoPoint;
import com.stlmonitor.core.model.Incident;
import com.stlmonitor.core.model.IncidentCategory;
import com.stlmonitor.core.model.IngestionReport;
import com.stlmonitor.core.model.NewsItem;
import com.stlmonitor.core.model.SourceStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalNewsCollectorTest {
    private static final Gazetteer GAZETTEER = Gazetteer.loadDefault();
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");
    private static final String ONE_ITEM_FEED = "<rss version=\"2.0\"><channel><item>"
            + "<title>Crash closes I-64 at Kingshighway</title>"
            + "<link>https://news.example.com/local/crash-i64-kingshighway</link>"
            + "<description>Police closed the interchange.</description>"
            + "<pubDate>Mon, 09 Feb 2026 19:00:00 GMT</pubDate>"
            + "</item></channel></rss>";

    private FeedServer server;
    private EventBus bus;
    private EventCapture capture;
    private InMemoryIncidentBoard board;

    @BeforeEach
    void setUp() throws Exception {
        server = new FeedServer();
        bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });
        capture = new EventCapture(bus);
        board = new InMemoryIncidentBoard();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void relayRescuesTimedOutSourceAndPlacesTheArticle() {
        server.hang("/slow-feed");
        server.handle("/relay", exchange -> FeedServer.write(exchange, 200, "text/xml", ONE_ITEM_FEED));

        NewsFeedConfig cfg = config(
                List.of(new FeedSource("Gateway Daily", server.url("/slow-feed"))),
                List.of(new RelayConfig("local-relay", server.url("/relay?url="), Envelope.RAW))
        );

        IngestionReport report = collector().fetchLocalNews(context(cfg, Clock.fixed(NOW, ZoneOffset.UTC))).join();

        assertEquals(1, report.items().size());
        NewsItem item = report.items().get(0);
        assertEquals("Crash closes I-64 at Kingshighway", item.title());
        assertEquals("Gateway Daily", item.outlet());
        assertEquals(new GeoPoint(38.63, -90.26), item.location());
        assertEquals(ConfidenceLevel.HIGH, item.geocodingConfidence());
        assertEquals(LocalNewsCollector.newsId("https://news.example.com/local/crash-i64-kingshighway"), item.id());
        assertTrue(item.id().matches("news-[0-9a-f]{12}"));
        assertTrue(report.allSourcesFetched());
    }

    @Test
    void fixtureRunKeepsPlacedArticlesInsideTheRecencyWindow() {
        server.feed("/rss", FixtureUtils.readFixture("fixtures/stl-news-rss.xml"));
        NewsFeedConfig cfg = config(List.of(new FeedSource("Gateway Daily", server.url("/rss"))), List.of());

        IngestionReport report = collector().fetchLocalNews(context(cfg, Clock.fixed(NOW, ZoneOffset.UTC))).join();

        assertEquals(
                List.of("Crash closes I-64 at Kingshighway", "Water main break floods Soulard streets"),
                report.items().stream().map(NewsItem::title).toList(),
                "47h-old article kept, 49h-old article dropped, newest first"
        );
        assertEquals(new GeoPoint(38.6086, -90.2108), report.items().get(1).location());

        SourceStats stats = report.sources().get(0);
        assertTrue(stats.fetched());
        assertEquals(5, stats.parsed());
        assertEquals(4, stats.relevant());
        assertEquals(3, stats.geocoded());

        NewsIngestionCompleted completed = capture.byType(NewsIngestionCompleted.class).get(0);
        assertEquals(3, completed.totalItems());
        assertEquals(2, completed.withinWindow());
        assertEquals(2, completed.returned());
        assertEquals(2, completed.highConfidence());
        assertEquals(0, completed.mediumConfidence());
    }

    @Test
    void sameArticleFromTwoSourcesAppearsOnce() {
        server.feed("/a", ONE_ITEM_FEED);
        server.feed("/b", ONE_ITEM_FEED);
        NewsFeedConfig cfg = config(List.of(
                new FeedSource("Gateway Daily", server.url("/a")),
                new FeedSource("River City News", server.url("/b"))
        ), List.of());

        IngestionReport report = collector().fetchLocalNews(context(cfg, Clock.fixed(NOW, ZoneOffset.UTC))).join();

        assertEquals(1, report.items().size());
        assertEquals(1, report.sources().stream().mapToInt(SourceStats::relevant).sum());
    }

    @Test
    void unreachableSourceDoesNotSinkTheRun() {
        server.feed("/atom", FixtureUtils.readFixture("fixtures/stl-news-atom.xml"));
        server.respond("/down", 503, "text/plain", "unavailable");
        NewsFeedConfig cfg = config(List.of(
                new FeedSource("Riverfront Weekly", server.url("/atom"), List.of(), FeedDialect.ATOM),
                new FeedSource("Down Daily", server.url("/down"), List.of(server.url("/down")), FeedDialect.RSS)
        ), List.of());

        IngestionReport report = collector().fetchLocalNews(context(cfg, Clock.fixed(NOW, ZoneOffset.UTC))).join();

        assertEquals(2, report.items().size());
        assertFalse(report.allSourcesFetched());
        SourceStats down = report.sources().get(1);
        assertEquals("Down Daily", down.source());
        assertFalse(down.fetched());
        assertEquals(2, server.hits("/down"), "primary and fallback URL each tried once");
        assertEquals(1, capture.byType(AlertRaised.class).size());
    }

    @Test
    void secondRunStartsWithAFreshSeenSetAndHonoursTheMovedClock() {
        server.feed("/rss", ONE_ITEM_FEED);
        MutableClock clock = new MutableClock(NOW, ZoneOffset.UTC);
        NewsFeedConfig cfg = config(List.of(new FeedSource("Gateway Daily", server.url("/rss"))), List.of());
        LocalNewsCollector collector = collector();

        assertEquals(1, collector.fetchLocalNews(context(cfg, clock)).join().items().size());
        assertEquals(1, collector.fetchLocalNews(context(cfg, clock)).join().items().size());

        clock.advance(Duration.ofHours(48));
        assertTrue(collector.fetchLocalNews(context(cfg, clock)).join().items().isEmpty());
    }

    @Test
    void maxItemsCapsTheReturnedList() {
        server.feed("/rss", FixtureUtils.readFixture("fixtures/stl-news-rss.xml"));
        NewsFeedConfig cfg = new NewsFeedConfig(null, Duration.ofMillis(300), null, 1, null,
                List.of(new FeedSource("Gateway Daily", server.url("/rss"))), List.of());

        IngestionReport report = collector().fetchLocalNews(context(cfg, Clock.fixed(NOW, ZoneOffset.UTC))).join();

        assertEquals(1, report.items().size());
        assertEquals("Crash closes I-64 at Kingshighway", report.items().get(0).title());
    }

    @Test
    void pollPublishesNewsIncidentsToTheBoard() {
        server.feed("/rss", FixtureUtils.readFixture("fixtures/stl-news-rss.xml"));
        NewsFeedConfig cfg = config(List.of(new FeedSource("Gateway Daily", server.url("/rss"))), List.of());

        CollectorResult result = collector().poll(context(cfg, Clock.fixed(NOW, ZoneOffset.UTC))).join();

        assertTrue(result.success());
        assertEquals(2, result.stats().get("incidents"));
        assertEquals(2, board.news().size());
        List<Incident> incidents = board.incidents(IncidentCategory.NEWS);
        assertEquals(2, incidents.size());
        Incident crash = incidents.get(0);
        assertEquals("news-" + board.news().get(0).id(), crash.id());
        assertEquals("Gateway Daily", crash.subtype());
        assertEquals(NewsIncidentMapper.NEWS_SEVERITY, crash.severity());
        assertEquals(NOW, crash.updatedAt());
        assertNotNull(crash.description());
        assertEquals(2, capture.byType(IncidentsUpdated.class).get(0).incidentCount());
    }

    @Test
    void missingConfigFailsThePollButStillClosesTheTick() {
        CollectorContext ctx = new CollectorContext(
                HttpClient.newHttpClient(), bus, board, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMillis(300), Map.of());

        CollectorResult result = collector().poll(ctx).join();

        assertFalse(result.success());
        assertTrue(result.message().contains(LocalNewsCollector.CONFIG_KEY));
    }

    @Test
    void defaultConfigCarriesTheStandardKeywordsAndRelays() {
        NewsFeedConfig cfg = NewsFeedConfig.withSources(List.of());

        assertEquals(RelevanceFilter.DEFAULT_KEYWORDS, cfg.keywords());
        assertEquals(RelayConfig.DEFAULTS, cfg.relays());
        assertEquals(Duration.ofHours(48), cfg.recencyWindow());
        assertEquals(100, cfg.maxItems());
    }

    private LocalNewsCollector collector() {
        return new LocalNewsCollector(GAZETTEER, Duration.ofMinutes(5), () -> 0.5);
    }

    private NewsFeedConfig config(List<FeedSource> sources, List<RelayConfig> relays) {
        return new NewsFeedConfig(null, Duration.ofMillis(300), null, 0, null, sources, relays);
    }

    private CollectorContext context(NewsFeedConfig cfg, Clock clock) {
        return new CollectorContext(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
                bus,
                board,
                clock,
                Duration.ofSeconds(1),
                Map.of(LocalNewsCollector.CONFIG_KEY, cfg)
        );
    }
}
