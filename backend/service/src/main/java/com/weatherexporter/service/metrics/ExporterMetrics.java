package com.weatherexporter.service.metrics;

import com.weatherexporter.collectors.api.FetchErrorReason;
import com.weatherexporter.collectors.api.FieldRejectionReason;
import com.weatherexporter.core.model.ObservationField;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;

/**
 * Long-lived meters describing the exporter itself: upstream fetch outcomes and latency, rejected
 * observation fields, the startup station lookup, skipped refreshes, observation timestamp regressions
 * and served scrapes. These render even before the first successful fetch.
 */
public final class ExporterMetrics {
    static final String FETCH = "weather.upstream.fetch";
    static final String FETCH_DURATION = "weather.upstream.fetch.duration";
    static final String REFRESH_SKIPPED = "weather.refresh.skipped";
    static final String OBSERVATION_REGRESSIONS = "weather.observation.regressions";
    static final String SCRAPES = "weather.scrapes";
    public static final String FIELD_REJECTED = "weather.observation.field.rejected";
    public static final String STATION_LOOKUP = "weather.station.lookup";
    public static final String STATION_LOOKUP_FAILURES = "weather.station.lookup.failures";
    static final String INTERNAL_REASON = "internal";

    private final PrometheusMeterRegistry registry;

    public ExporterMetrics() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public ExporterMetrics(PrometheusMeterRegistry registry) {
        this.registry = registry;
        fetchCounter("success", "none");
        for (FetchErrorReason reason : FetchErrorReason.values()) {
            fetchCounter("failure", reason.label());
        }
        Counter.builder(REFRESH_SKIPPED)
                .description("Refresh attempts skipped because another refresh was in flight.")
                .register(registry);
        Counter.builder(STATION_LOOKUP_FAILURES)
                .description("Nearest-station lookups that failed at startup.")
                .register(registry);
        Counter.builder(OBSERVATION_REGRESSIONS)
                .description("Successful fetches whose observation timestamp was older than the cached one.")
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public Timer.Sample startFetch() {
        return Timer.start(registry);
    }

    public void fetchSucceeded(Timer.Sample sample) {
        sample.stop(fetchTimer("success"));
        fetchCounter("success", "none").increment();
    }

    public void fetchFailed(Timer.Sample sample, FetchErrorReason reason) {
        fetchFailed(sample, reason.label());
    }

    /**
     * Records a refresh that died with an unexpected exception rather than a classified fetch error.
     */
    public void fetchCrashed(Timer.Sample sample) {
        fetchFailed(sample, INTERNAL_REASON);
    }

    /**
     * Counts a reported quantity that was dropped from an observation. Wired into the parser as its
     * {@link com.weatherexporter.collectors.api.FieldRejectionListener}.
     */
    public void fieldRejected(ObservationField field, FieldRejectionReason reason, String unitCode) {
        Counter.builder(FIELD_REJECTED)
                .description("Observation fields dropped because of a non-numeric value or an unusable unit.")
                .tag("field", field.payloadKey())
                .tag("reason", reason.label())
                .register(registry)
                .increment();
    }

    public Timer.Sample startStationLookup() {
        return Timer.start(registry);
    }

    public void stationLookupSucceeded(Timer.Sample sample) {
        sample.stop(stationLookupTimer("success"));
    }

    public void stationLookupFailed(Timer.Sample sample) {
        sample.stop(stationLookupTimer("failure"));
        registry.counter(STATION_LOOKUP_FAILURES).increment();
    }

    public void refreshSkipped() {
        registry.counter(REFRESH_SKIPPED).increment();
    }

    public void observationRegressed() {
        registry.counter(OBSERVATION_REGRESSIONS).increment();
    }

    public void scrapeServed(int status) {
        Counter.builder(SCRAPES)
                .description("Metrics scrapes served, by HTTP status.")
                .tag("status", Integer.toString(status))
                .register(registry)
                .increment();
    }

    public double count(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter == null ? 0.0 : counter.count();
    }

    public String scrape() {
        return registry.scrape();
    }

    private void fetchFailed(Timer.Sample sample, String reasonLabel) {
        sample.stop(fetchTimer("failure"));
        fetchCounter("failure", reasonLabel).increment();
    }

    private Counter fetchCounter(String result, String reason) {
        return Counter.builder(FETCH)
                .description("Upstream observation fetches by result and failure reason.")
                .tag("result", result)
                .tag("reason", reason)
                .register(registry);
    }

    private Timer stationLookupTimer(String result) {
        return Timer.builder(STATION_LOOKUP)
                .description("Time spent resolving the nearest station for the configured coordinates.")
                .tag("result", result)
                .register(registry);
    }

    private Timer fetchTimer(String result) {
        return Timer.builder(FETCH_DURATION)
                .description("Time spent fetching the latest observation from upstream.")
                .tag("result", result)
                .register(registry);
    }
}
