package com.stlmonitor.collectors.news;

import com.stlmonitor.core.geo.GeoFence;
import com.stlmonitor.core.model.ConfidenceLevel;
import com.stlmonitor.core.model.DataSource;
import com.stlmonitor.core.model.Incident;
import com.stlmonitor.core.model.IncidentCategory;
import com.stlmonitor.core.model.IncidentStatus;
import com.stlmonitor.core.model.NewsItem;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Puts placed news items on the map. Items are checked against the fence once more since they may come from a
 * stored copy rather than a fresh geocode.
 */
public class NewsIncidentMapper {
    public static final int NEWS_SEVERITY = 30;

    private static final Logger LOGGER = Logger.getLogger(NewsIncidentMapper.class.getName());

    private final GeoFence fence;
    private final Clock clock;

    public NewsIncidentMapper(GeoFence fence, Clock clock) {
        this.fence = fence;
        this.clock = clock;
    }

    public List<Incident> toIncidents(List<NewsItem> items) {
        Instant now = clock.instant();
        List<Incident> incidents = new ArrayList<>();
        for (NewsItem item : items) {
            if (!item.isPlaced()) {
                continue;
            }
            if (item.geocodingConfidence() == ConfidenceLevel.LOW) {
                LOGGER.warning(() -> "Rejecting news item \"" + abbreviate(item.title()) + "\": confidence too low");
                continue;
            }
            if (!fence.isWithinBounds(item.location())) {
                LOGGER.warning(() -> "Rejecting news item \"" + abbreviate(item.title()) + "\": location outside metro bounds ("
                        + item.location().lat() + ", " + item.location().lng() + ")");
                continue;
            }
            incidents.add(new Incident(
                    "news-" + item.id(),
                    item.title(),
                    item.snippet(),
                    IncidentCategory.NEWS,
                    item.outlet(),
                    NEWS_SEVERITY,
                    item.geocodingConfidence(),
                    IncidentStatus.ACTIVE,
                    item.location(),
                    null,
                    DataSource.LOCAL_NEWS,
                    item.url(),
                    item.publishedAt(),
                    now,
                    null
            ));
        }
        return incidents;
    }

    private static String abbreviate(String title) {
        if (title == null) {
            return "";
        }
        return title.length() > 50 ? title.substring(0, 50) + "..." : title;
    }
}
