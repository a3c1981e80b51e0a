package com.stlmonitor.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.stlmonitor.collectors.config.NewsFeedConfig;
import com.stlmonitor.collectors.config.WeatherAlertConfig;
import com.stlmonitor.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the JSON files under the service config directory. Any missing or malformed file stops startup.
 */
public final class ConfigLoader {
    public static final String COLLECTORS_FILE = "collectors.json";
    public static final String FEEDS_FILE = "feeds.json";
    public static final String WEATHER_FILE = "weather.json";

    private ConfigLoader() {
    }

    public static List<CollectorConfig> loadCollectors(Path configDir) {
        return read(configDir.resolve(COLLECTORS_FILE), new TypeReference<>() {
        });
    }

    public static NewsFeedConfig loadFeeds(Path configDir) {
        NewsFeedConfig config = read(configDir.resolve(FEEDS_FILE), new TypeReference<>() {
        });
        if (config.sources().isEmpty()) {
            throw new IllegalStateException("No feed sources configured in " + configDir.resolve(FEEDS_FILE));
        }
        return config;
    }

    /**
     * {@code weather.json} is optional; without it the NWS defaults apply.
     */
    public static WeatherAlertConfig loadWeather(Path configDir) {
        Path path = configDir.resolve(WEATHER_FILE);
        if (!Files.exists(path)) {
            return new WeatherAlertConfig(null, null, null);
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
