package com.weatherexporter.service.config;

import com.weatherexporter.collectors.config.StationConfig;
import com.weatherexporter.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Builds the exporter configuration from an optional {@code exporter.json} in the config directory, with
 * environment variables taking precedence over file values and defaults filling the rest.
 */
public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());
    static final String CONFIG_FILE = "exporter.json";

    private ConfigLoader() {
    }

    public static ExporterConfig load(Path configDir, Map<String, String> env) {
        FileSettings file = readFile(configDir.resolve(CONFIG_FILE));

        String stationId = firstNonBlank(env.get("WEATHER_STATION_ID"), file.stationId());
        String stationUrl = firstNonBlank(env.get("WEATHER_STATION_URL"), file.stationUrl());
        Double latitude = parsed(env, "WEATHER_LATITUDE", file.latitude(), Double::parseDouble);
        Double longitude = parsed(env, "WEATHER_LONGITUDE", file.longitude(), Double::parseDouble);

        if (stationId == null && stationUrl == null && (latitude == null || longitude == null)) {
            throw new IllegalStateException(
                    "No station configured: set WEATHER_STATION_ID, WEATHER_STATION_URL or WEATHER_LATITUDE/WEATHER_LONGITUDE");
        }
        if ((latitude == null) != (longitude == null)) {
            throw new IllegalStateException("WEATHER_LATITUDE and WEATHER_LONGITUDE must be set together");
        }

        String modeRaw = firstNonBlank(env.get("REFRESH_MODE"), file.refreshMode());
        RefreshMode mode = modeRaw == null ? RefreshMode.INTERVAL : parseMode(modeRaw);

        return new ExporterConfig(
                stationId,
                stationUrl,
                latitude,
                longitude,
                orDefault(firstNonBlank(env.get("WEATHER_API_BASE_URL"), file.apiBaseUrl()), StationConfig.DEFAULT_API_BASE_URL),
                orDefault(firstNonBlank(env.get("WEATHER_USER_AGENT"), file.userAgent()), ExporterConfig.DEFAULT_USER_AGENT),
                port(parsed(env, "LISTEN_PORT", file.listenPort(), Integer::parseInt)),
                mode,
                seconds(env, "REFRESH_INTERVAL_SECONDS", file.refreshIntervalSeconds(), ExporterConfig.DEFAULT_REFRESH_INTERVAL),
                seconds(env, "FRESHNESS_THRESHOLD_SECONDS", file.freshnessThresholdSeconds(), ExporterConfig.DEFAULT_FRESHNESS_THRESHOLD),
                seconds(env, "REQUEST_TIMEOUT_SECONDS", file.requestTimeoutSeconds(), ExporterConfig.DEFAULT_REQUEST_TIMEOUT),
                positive("HTTP_THREADS", orDefault(parsed(env, "HTTP_THREADS", file.httpThreads(), Integer::parseInt), ExporterConfig.DEFAULT_HTTP_THREADS))
        );
    }

    private static FileSettings readFile(Path path) {
        if (!Files.exists(path)) {
            LOGGER.fine("No " + path + "; using environment and defaults");
            return FileSettings.EMPTY;
        }
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, FileSettings.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static RefreshMode parseMode(String raw) {
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return RefreshMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid REFRESH_MODE '" + raw + "', expected interval or on_demand", e);
        }
    }

    private static <T> T parsed(Map<String, String> env, String key, T fileValue, Function<String, T> parser) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fileValue;
        }
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid value for " + key + ": '" + raw + "'", e);
        }
    }

    private static Duration seconds(Map<String, String> env, String key, Long fileValue, Duration fallback) {
        Long value = parsed(env, key, fileValue, Long::parseLong);
        if (value == null) {
            return fallback;
        }
        if (value < 1) {
            throw new IllegalStateException("Invalid value for " + key + ": must be at least 1 but was " + value);
        }
        return Duration.ofSeconds(value);
    }

    private static int port(Integer value) {
        if (value == null) {
            return ExporterConfig.DEFAULT_LISTEN_PORT;
        }
        if (value < 0 || value > 65535) {
            throw new IllegalStateException("Invalid value for LISTEN_PORT: " + value);
        }
        return value;
    }

    private static int positive(String key, int value) {
        if (value < 1) {
            throw new IllegalStateException("Invalid value for " + key + ": must be at least 1 but was " + value);
        }
        return value;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        if (second != null && !second.isBlank()) {
            return second.trim();
        }
        return null;
    }

    private static <T> T orDefault(T value, T fallback) {
        return value == null ? fallback : value;
    }

    record FileSettings(
            String stationId,
            String stationUrl,
            Double latitude,
            Double longitude,
            String apiBaseUrl,
            String userAgent,
            Integer listenPort,
            String refreshMode,
            Long refreshIntervalSeconds,
            Long freshnessThresholdSeconds,
            Long requestTimeoutSeconds,
            Integer httpThreads
    ) {
        static final FileSettings EMPTY = new FileSettings(null, null, null, null, null, null, null, null, null, null, null, null);
    }
}
