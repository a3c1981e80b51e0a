package com.stlmonitor.service.api;

import com.stlmonitor.core.model.Incident;
import com.stlmonitor.core.model.IncidentCategory;
import com.stlmonitor.core.model.NewsItem;
import com.stlmonitor.core.util.JsonUtils;
import com.stlmonitor.service.runtime.SchedulerService;
import com.stlmonitor.service.store.EventCodec;
import com.stlmonitor.service.store.EventLog;
import com.stlmonitor.service.store.InMemoryIncidentBoard;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only JSON API over the incident board and the service diagnostics.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final int DEFAULT_EVENT_LIMIT = 200;

    private final int port;
    private final InMemoryIncidentBoard board;
    private final EventLog eventLog;
    private final List<SchedulerService.ScheduledCollector> collectors;
    private final DiagnosticsTracker diagnosticsTracker;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            InMemoryIncidentBoard board,
            EventLog eventLog,
            List<SchedulerService.ScheduledCollector> collectors,
            DiagnosticsTracker diagnosticsTracker
    ) {
        this.port = port;
        this.board = board;
        this.eventLog = eventLog;
        this.collectors = List.copyOf(collectors);
        this.diagnosticsTracker = diagnosticsTracker;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(4);
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/incidents", this::handleIncidents);
            server.createContext("/api/news", this::handleNews);
            server.createContext("/api/events", this::handleEvents);
            server.createContext("/api/collectors", this::handleCollectors);
            server.createContext("/api/collectors/status", this::handleCollectorStatus);
            server.createContext("/api/metrics", this::handleMetrics);
            server.start();
            LOGGER.info(() -> "API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    /**
     * {@code ?category=news} narrows to one category; unknown categories are a 400.
     */
    private void handleIncidents(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        String category = queryParams(exchange.getRequestURI()).get("category");
        if (category == null || category.isBlank()) {
            writeJson(exchange, 200, board.incidents());
            return;
        }
        Optional<IncidentCategory> parsed = Arrays.stream(IncidentCategory.values())
                .filter(value -> value.wireName().equals(category.trim().toLowerCase(Locale.ROOT)))
                .findFirst();
        if (parsed.isEmpty()) {
            writeJson(exchange, 400, Map.of("error", "unknown_category"));
            return;
        }
        List<Incident> incidents = board.incidents(parsed.get());
        writeJson(exchange, 200, incidents);
    }

    /**
     * {@code ?placed=true} returns only articles that carry a coordinate.
     */
    private void handleNews(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        boolean placedOnly = "true".equalsIgnoreCase(queryParams(exchange.getRequestURI()).get("placed"));
        List<NewsItem> news = placedOnly
                ? board.news().stream().filter(NewsItem::isPlaced).toList()
                : board.news();
        writeJson(exchange, 200, news);
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }

        Instant since;
        Optional<String> type;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : DEFAULT_EVENT_LIMIT;
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }

        writeJson(exchange, 200, eventLog.query(since, type, Math.max(1, limit)).stream()
                .map(EventCodec::wrap)
                .toList());
    }

    private void handleCollectors(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        List<Map<String, Object>> dto = new ArrayList<>();
        for (SchedulerService.ScheduledCollector scheduled : collectors) {
            dto.add(Map.of(
                    "name", scheduled.collector().name(),
                    "intervalSeconds", scheduled.interval().toSeconds(),
                    "enabled", scheduled.enabled()
            ));
        }
        writeJson(exchange, 200, dto);
    }

    private void handleCollectorStatus(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, diagnosticsTracker.collectorsSnapshot());
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange)) {
            return;
        }
        writeJson(exchange, 200, diagnosticsTracker.metricsSnapshot());
    }

    private boolean ensureGet(HttpExchange exchange) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        try {
            payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed serializing response for " + exchange.getRequestURI(), e);
            status = 500;
            payload = "{\"error\":\"serialization_failed\"}".getBytes(StandardCharsets.UTF_8);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}
