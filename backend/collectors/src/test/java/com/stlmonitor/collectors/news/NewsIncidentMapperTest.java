package com.stlmonitor.collectors.news;

import com.stlmonitor.collectors.support.EventCapture;
import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.events.LocationRejected;
import com.stlmonitor.core.geo.GeoFence;
import com.stlmonitor.core.geo.MetroRegion;
import com.stlmonitor.core.model.ConfidenceLevel;
import com.stlmonitor.core.model.DataSource;
import com.stlmonitor.core.model.GeoPoint;
import com.stlmonitor.core.model.Incident;
import com.stlmonitor.core.model.IncidentCategory;
import com.stlmonitor.core.model.IncidentStatus;
import com.stlmonitor.core.model.NewsItem;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class NewsIncidentMapperTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");
    private static final Instant PUBLISHED = Instant.parse("2026-02-09T18:30:00Z");

    @Test
    void onlyPlacedConfidentInBoundsItemsBecomeIncidents() {
        EventBus bus = new EventBus();
        EventCapture capture = new EventCapture(bus);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        NewsIncidentMapper mapper = new NewsIncidentMapper(new GeoFence(MetroRegion.ST_LOUIS, bus, clock), clock);

        List<Incident> incidents = mapper.toIncidents(List.of(
                item("news-aaa", new GeoPoint(38.6270, -90.1994), ConfidenceLevel.MEDIUM),
                item("news-bbb", null, null),
                item("news-ccc", new GeoPoint(38.6270, -90.1994), ConfidenceLevel.LOW),
                item("news-ddd", new GeoPoint(38.7700, -89.8000), ConfidenceLevel.HIGH)
        ));

        assertEquals(1, incidents.size());
        Incident incident = incidents.get(0);
        assertEquals("news-news-aaa", incident.id());
        assertEquals(IncidentCategory.NEWS, incident.category());
        assertEquals("Gateway Daily", incident.subtype());
        assertEquals(30, incident.severity());
        assertEquals(ConfidenceLevel.MEDIUM, incident.confidence());
        assertEquals(IncidentStatus.ACTIVE, incident.status());
        assertEquals(DataSource.LOCAL_NEWS, incident.source());
        assertEquals("https://news.example.com/news-aaa", incident.sourceUrl());
        assertEquals("Snippet", incident.description());
        assertEquals(PUBLISHED, incident.createdAt());
        assertEquals(NOW, incident.updatedAt());
        assertNull(incident.expiresAt());
        assertEquals(1, capture.byType(LocationRejected.class).size());
    }

    private static NewsItem item(String id, GeoPoint location, ConfidenceLevel confidence) {
        return new NewsItem(id, "Headline " + id, "Gateway Daily", "https://news.example.com/" + id, PUBLISHED,
                "Snippet", location, confidence);
    }
}
