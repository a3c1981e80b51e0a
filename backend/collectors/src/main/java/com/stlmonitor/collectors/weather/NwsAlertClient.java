package com.stlmonitor.collectors.weather;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.stlmonitor.collectors.config.WeatherAlertConfig;
import com.stlmonitor.core.model.GeoPolygon;
import com.stlmonitor.core.model.WeatherAlert;
import com.stlmonitor.core.util.JsonUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Active alerts for Missouri and Illinois from the National Weather Service, narrowed to the St. Louis area.
 */
public class NwsAlertClient {
    private static final TypeReference<List<List<List<Double>>>> RINGS = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final Duration timeout;

    public NwsAlertClient(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    public CompletableFuture<List<WeatherAlert>> fetchActiveAlerts(WeatherAlertConfig cfg) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(cfg.endpoint()))
                .GET()
                .timeout(timeout)
                .header("Accept", "application/geo+json")
                .header("User-Agent", cfg.userAgent())
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(response -> {
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw new IllegalStateException("NWS API error: " + response.statusCode());
                    }
                    return parseAlerts(response.body());
                });
    }

    static List<WeatherAlert> parseAlerts(String json) {
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException("NWS response is not valid JSON", e);
        }
        List<WeatherAlert> alerts = new ArrayList<>();
        for (JsonNode feature : root.path("features")) {
            JsonNode props = feature.path("properties");
            if (!isMetroArea(props)) {
                continue;
            }
            String event = text(props, "event");
            String headline = text(props, "headline");
            alerts.add(new WeatherAlert(
                    text(props, "id"),
                    event,
                    headline == null ? event : headline,
                    props.path("description").asText(""),
                    text(props, "severity"),
                    text(props, "urgency"),
                    polygon(feature.path("geometry")),
                    instant(props, "effective"),
                    instant(props, "expires")
            ));
        }
        return alerts;
    }

    static boolean isMetroArea(JsonNode props) {
        for (JsonNode zone : props.path("affectedZones")) {
            String value = zone.asText("");
            if (value.contains("MOZ") || value.contains("ILZ")) {
                return true;
            }
        }
        return props.path("areaDesc").asText("").toLowerCase(Locale.ROOT).contains("st. louis");
    }

    private static GeoPolygon polygon(JsonNode geometry) {
        if (!"Polygon".equals(geometry.path("type").asText(null))) {
            return null;
        }
        return new GeoPolygon("Polygon", JsonUtils.objectMapper().convertValue(geometry.path("coordinates"), RINGS));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
