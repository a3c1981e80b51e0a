package com.stlmonitor.collectors.config;

import java.time.Duration;

public record WeatherAlertConfig(Duration interval, String endpoint, String userAgent) {
    public static final String DEFAULT_ENDPOINT = "https://api.weather.gov/alerts/active?area=MO,IL&status=actual";
    public static final String DEFAULT_USER_AGENT = "STLMonitor/1.0 (amer.lol)";

    public WeatherAlertConfig {
        interval = interval == null ? Duration.ofMinutes(5) : interval;
        endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint;
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }
}
