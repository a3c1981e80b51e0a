package com.stlmonitor.service.config;

/**
 * One entry of {@code collectors.json}: whether a collector is scheduled and how often.
 */
public record CollectorConfig(
        String name,
        boolean enabled,
        int intervalSeconds
) {
}
