package com.weatherexporter.service.config;

import java.time.Duration;
import java.util.Objects;

public record ExporterConfig(
        String stationId,
        String stationUrl,
        Double latitude,
        Double longitude,
        String apiBaseUrl,
        String userAgent,
        int listenPort,
        RefreshMode refreshMode,
        Duration refreshInterval,
        Duration freshnessThreshold,
        Duration requestTimeout,
        int httpThreads
) {
    public static final String DEFAULT_USER_AGENT = "weather-exporter/1.0 (contact: ops@example.com)";
    public static final int DEFAULT_LISTEN_PORT = 5000;
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_FRESHNESS_THRESHOLD = Duration.ofMinutes(5);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_HTTP_THREADS = 4;

    public ExporterConfig {
        Objects.requireNonNull(apiBaseUrl, "apiBaseUrl is required");
        Objects.requireNonNull(userAgent, "userAgent is required");
        Objects.requireNonNull(refreshMode, "refreshMode is required");
        Objects.requireNonNull(refreshInterval, "refreshInterval is required");
        Objects.requireNonNull(freshnessThreshold, "freshnessThreshold is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
