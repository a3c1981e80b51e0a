package com.stlmonitor.collectors;

import com.stlmonitor.collectors.api.CollectorContext;
import com.stlmonitor.collectors.config.NewsFeedConfig;
import com.stlmonitor.collectors.config.RelayConfig;
import com.stlmonitor.collectors.config.WeatherAlertConfig;
import com.stlmonitor.collectors.feed.Envelope;
import com.stlmonitor.collectors.news.LocalNewsCollector;
import com.stlmonitor.collectors.support.CollectorContractAssertions;
import com.stlmonitor.collectors.support.EventCapture;
import com.stlmonitor.collectors.support.FeedServer;
import com.stlmonitor.collectors.support.FixtureUtils;
import com.stlmonitor.collectors.support.InMemoryIncidentBoard;
import com.stlmonitor.collectors.weather.WeatherAlertCollector;
import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.events.AlertRaised;
import com.stlmonitor.core.geo.Gazetteer;
import com.stlmonitor.core.model.FeedSource;
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
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollectorContractTest {
    private FeedServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new FeedServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void localNewsCollectorSatisfiesContractOnPartialFailure() {
        server.feed("/good", FixtureUtils.readFixture("fixtures/stl-news-rss.xml"));
        server.hang("/hang");
        server.respond("/relay", 502, "text/plain", "bad gateway");

        NewsFeedConfig cfg = new NewsFeedConfig(
                Duration.ofMinutes(5),
                Duration.ofMillis(200),
                null,
                0,
                null,
                List.of(new FeedSource("good", server.url("/good")), new FeedSource("hang", server.url("/hang"))),
                List.of(new RelayConfig("local-relay", server.url("/relay?url="), Envelope.RAW))
        );

        EventBus bus = silentBus();
        EventCapture capture = new EventCapture(bus);
        LocalNewsCollector collector = new LocalNewsCollector(Gazetteer.loadDefault());
        CollectorContext ctx = context(bus, Map.of(LocalNewsCollector.CONFIG_KEY, cfg));

        CollectorContractAssertions.assertContract(collector, ctx, capture, Duration.ofSeconds(5), true);
        CollectorContractAssertions.assertTickEnvelope(capture, collector.name());
        List<AlertRaised> alerts = capture.byType(AlertRaised.class);
        assertEquals(1, alerts.size());
        assertTrue(alerts.get(0).details().containsValue("hang"));
    }

    @Test
    void weatherAlertCollectorSatisfiesContractOnFailure() {
        server.respond("/alerts", 503, "text/plain", "unavailable");

        EventBus bus = silentBus();
        EventCapture capture = new EventCapture(bus);
        WeatherAlertCollector collector = new WeatherAlertCollector();
        CollectorContext ctx = context(bus, Map.of(
                WeatherAlertCollector.CONFIG_KEY, new WeatherAlertConfig(null, server.url("/alerts"), null)));

        CollectorContractAssertions.assertContract(collector, ctx, capture, Duration.ofSeconds(5), true);
        CollectorContractAssertions.assertTickEnvelope(capture, collector.name());
    }

    private static CollectorContext context(EventBus bus, Map<String, Object> config) {
        return new CollectorContext(
                HttpClient.newBuilder().connectTimeout(Duration.ofMillis(500)).build(),
                bus,
                new InMemoryIncidentBoard(),
                Clock.fixed(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC),
                Duration.ofMillis(500),
                config
        );
    }

    private static EventBus silentBus() {
        return new EventBus((event, error) -> {
        });
    }
}
