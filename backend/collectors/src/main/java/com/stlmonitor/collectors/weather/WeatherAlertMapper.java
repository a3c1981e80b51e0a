package com.stlmonitor.collectors.weather;

import com.stlmonitor.core.geo.MetroRegion;
import com.stlmonitor.core.model.ConfidenceLevel;
import com.stlmonitor.core.model.DataSource;
import com.stlmonitor.core.model.Incident;
import com.stlmonitor.core.model.IncidentCategory;
import com.stlmonitor.core.model.IncidentStatus;
import com.stlmonitor.core.model.WeatherAlert;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Weather alerts cover an area rather than a point, so every incident is pinned to the metro centre and carries the
 * alert polygon when there is one.
 */
public class WeatherAlertMapper {
    private final MetroRegion region;
    private final Clock clock;

    public WeatherAlertMapper(MetroRegion region, Clock clock) {
        this.region = region;
        this.clock = clock;
    }

    public List<Incident> toIncidents(List<WeatherAlert> alerts) {
        Instant now = clock.instant();
        return alerts.stream()
                .map(alert -> new Incident(
                        "weather-" + alert.id(),
                        alert.headline(),
                        alert.description(),
                        IncidentCategory.WEATHER,
                        alert.event(),
                        severityOf(alert.severity()),
                        ConfidenceLevel.HIGH,
                        IncidentStatus.ACTIVE,
                        region.center(),
                        alert.polygon(),
                        DataSource.NWS,
                        null,
                        alert.effective() == null ? now : alert.effective(),
                        now,
                        alert.expires()
                ))
                .toList();
    }

    static int severityOf(String severity) {
        if (severity == null) {
            return 20;
        }
        return switch (severity) {
            case "Extreme" -> 100;
            case "Severe" -> 80;
            case "Moderate" -> 50;
            case "Minor" -> 30;
            default -> 20;
        };
    }
}
