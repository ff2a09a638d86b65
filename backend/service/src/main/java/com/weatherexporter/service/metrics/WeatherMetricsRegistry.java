package com.weatherexporter.service.metrics;

import com.weatherexporter.core.model.CacheEntry;
import com.weatherexporter.core.model.Observation;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Renders the cached observation as Prometheus exposition text.
 *
 * <p>Weather gauges are registered on a fresh registry for every render, so a field that is absent from
 * the current observation produces no lines at all instead of a stale or NaN sample. The exporter's own
 * meters are appended after them.
 */
public class WeatherMetricsRegistry {
    static final String LAST_FETCH_AGE = "weather.last.fetch.age";
    static final String OBSERVATION_TIMESTAMP = "weather.observation.timestamp";
    static final String OBSERVATION_AGE = "weather.observation.age";

    private final List<MetricDescriptor> descriptors;
    private final ExporterMetrics exporterMetrics;
    private final Clock clock;

    public WeatherMetricsRegistry(ExporterMetrics exporterMetrics, Clock clock) {
        this(MetricDescriptor.WEATHER, exporterMetrics, clock);
    }

    WeatherMetricsRegistry(List<MetricDescriptor> descriptors, ExporterMetrics exporterMetrics, Clock clock) {
        this.descriptors = List.copyOf(descriptors);
        this.exporterMetrics = exporterMetrics;
        this.clock = clock;
    }

    public String render(Optional<CacheEntry> entry) {
        try {
            StringBuilder out = new StringBuilder();
            entry.ifPresent(present -> out.append(renderEntry(present, clock.instant())));
            out.append(exporterMetrics.scrape());
            return out.toString();
        } catch (RuntimeException e) {
            throw new MetricsRenderException("Failed rendering metrics", e);
        }
    }

    private String renderEntry(CacheEntry entry, Instant now) {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        try {
            Observation observation = entry.observation();
            for (MetricDescriptor descriptor : descriptors) {
                Double value = observation.valueOf(descriptor.field());
                if (value == null) {
                    continue;
                }
                Gauge.builder(descriptor.name(), () -> value)
                        .description(descriptor.help())
                        .baseUnit(descriptor.baseUnit())
                        .register(registry);
            }

            double fetchAge = seconds(entry.age(now));
            Gauge.builder(LAST_FETCH_AGE, () -> fetchAge)
                    .description("Seconds since the last successful upstream fetch.")
                    .baseUnit("seconds")
                    .register(registry);

            double observedAt = epochSeconds(observation.observedAt());
            Gauge.builder(OBSERVATION_TIMESTAMP, () -> observedAt)
                    .description("Unix time the station reported the current observation at.")
                    .baseUnit("seconds")
                    .register(registry);

            double observationAge = Math.max(0.0, seconds(Duration.between(observation.observedAt(), now)));
            Gauge.builder(OBSERVATION_AGE, () -> observationAge)
                    .description("Seconds between the station's observation time and this scrape.")
                    .baseUnit("seconds")
                    .register(registry);

            return registry.scrape();
        } finally {
            registry.close();
        }
    }

    // getSeconds/getNano stay in range for any Instant, unlike toMillis
    static double seconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1e9;
    }

    static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1e9;
    }
}
