package com.stlmonitor.service;

import com.stlmonitor.collectors.api.CollectorContext;
import com.stlmonitor.collectors.api.CollectorResult;
import com.stlmonitor.collectors.config.NewsFeedConfig;
import com.stlmonitor.collectors.config.WeatherAlertConfig;
import com.stlmonitor.collectors.news.LocalNewsCollector;
import com.stlmonitor.collectors.weather.WeatherAlertCollector;
import com.stlmonitor.core.bus.EventBus;
import com.stlmonitor.core.geo.Gazetteer;
import com.stlmonitor.service.api.ApiServer;
import com.stlmonitor.service.api.DiagnosticsTracker;
import com.stlmonitor.service.config.CollectorConfig;
import com.stlmonitor.service.config.ConfigLoader;
import com.stlmonitor.service.http.HttpClientFactory;
import com.stlmonitor.service.runtime.SchedulerService;
import com.stlmonitor.service.store.EventLog;
import com.stlmonitor.service.store.InMemoryIncidentBoard;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("CONFIG_DIR", "config"));
        int port = port(env);
        boolean once = Arrays.asList(args).contains("--once");

        NewsFeedConfig feedConfig = ConfigLoader.loadFeeds(configDir);
        WeatherAlertConfig weatherConfig = withUserAgent(ConfigLoader.loadWeather(configDir), env.get("NWS_USER_AGENT"));
        List<CollectorConfig> collectorConfigs = ConfigLoader.loadCollectors(configDir);

        Map<String, CollectorConfig> collectorConfigByName = new HashMap<>();
        for (CollectorConfig cfg : collectorConfigs) {
            collectorConfigByName.put(cfg.name(), cfg);
        }

        EventBus eventBus = new EventBus();
        EventLog eventLog = new EventLog(eventBus);
        DiagnosticsTracker diagnosticsTracker = new DiagnosticsTracker(eventBus, Clock.systemUTC());
        InMemoryIncidentBoard board = new InMemoryIncidentBoard();

        LocalNewsCollector newsCollector = new LocalNewsCollector(
                Gazetteer.loadDefault(),
                intervalFor(collectorConfigByName, "localNewsCollector", feedConfig.interval())
        );
        WeatherAlertCollector weatherCollector = new WeatherAlertCollector(
                intervalFor(collectorConfigByName, "weatherAlertCollector", weatherConfig.interval())
        );

        HttpClient sharedHttpClient = HttpClientFactory.create(Duration.ofSeconds(5));
        CollectorContext context = new CollectorContext(
                sharedHttpClient,
                eventBus,
                board,
                Clock.systemUTC(),
                DEFAULT_REQUEST_TIMEOUT,
                Map.of(
                        LocalNewsCollector.CONFIG_KEY, feedConfig,
                        WeatherAlertCollector.CONFIG_KEY, weatherConfig
                )
        );

        List<SchedulerService.ScheduledCollector> scheduledCollectors = List.of(
                new SchedulerService.ScheduledCollector(
                        newsCollector,
                        newsCollector.interval(),
                        isEnabled(collectorConfigByName, newsCollector.name(), true)
                ),
                new SchedulerService.ScheduledCollector(
                        weatherCollector,
                        weatherCollector.interval(),
                        isEnabled(collectorConfigByName, weatherCollector.name(), true)
                )
        );
        SchedulerService scheduler = new SchedulerService(scheduledCollectors, context);

        if (once) {
            List<CollectorResult> results = scheduler.runOnceAllCollectors();
            results.forEach(result -> LOGGER.info(() -> result.message() + " " + result.stats()));
            LOGGER.info(() -> board.incidents().size() + " incidents, " + board.news().size() + " news items");
            scheduler.shutdown();
            return;
        }

        ApiServer apiServer = new ApiServer(port, board, eventLog, scheduledCollectors, diagnosticsTracker);
        scheduler.start();
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static int port(Map<String, String> env) {
        String raw = env.get("API_PORT");
        if (raw == null || raw.isBlank()) {
            return 8080;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("API_PORT must be a number, got: " + raw, e);
        }
    }

    static WeatherAlertConfig withUserAgent(WeatherAlertConfig config, String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return config;
        }
        return new WeatherAlertConfig(config.interval(), config.endpoint(), userAgent);
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning(() -> "Could not read logging.properties, using JDK defaults: " + e.getMessage());
        }
    }

    private static Duration intervalFor(Map<String, CollectorConfig> map, String name, Duration fallback) {
        CollectorConfig config = map.get(name);
        if (config == null) {
            return fallback;
        }
        return Duration.ofSeconds(Math.max(1, config.intervalSeconds()));
    }

    private static boolean isEnabled(Map<String, CollectorConfig> map, String name, boolean fallback) {
        CollectorConfig config = map.get(name);
        return config == null ? fallback : config.enabled();
    }
}
