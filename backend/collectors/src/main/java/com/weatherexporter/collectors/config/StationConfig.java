package com.weatherexporter.collectors.config;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Where and how the upstream client fetches observations.
 *
 * @param stationId      station identifier, used for logs and as the path segment of the default URL
 * @param observationUrl fully resolved latest-observation URL for the station
 * @param userAgent      contact-identifying client name; weather.gov rejects requests without one
 * @param requestTimeout upper bound for one request, connect through body
 */
public record StationConfig(String stationId, URI observationUrl, String userAgent, Duration requestTimeout) {
    public static final String DEFAULT_API_BASE_URL = "https://api.weather.gov";

    public StationConfig {
        Objects.requireNonNull(stationId, "stationId is required");
        Objects.requireNonNull(observationUrl, "observationUrl is required");
        Objects.requireNonNull(userAgent, "userAgent is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    public static StationConfig forStation(String apiBaseUrl, String stationId, String userAgent, Duration requestTimeout) {
        return new StationConfig(stationId, latestObservationUrl(apiBaseUrl, stationId), userAgent, requestTimeout);
    }

    public static URI latestObservationUrl(String apiBaseUrl, String stationId) {
        String base = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        return URI.create(base + "/stations/" + stationId.trim().toUpperCase(Locale.ROOT) + "/observations/latest");
    }
}
