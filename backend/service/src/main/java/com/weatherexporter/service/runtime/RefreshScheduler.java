package com.weatherexporter.service.runtime;

import com.weatherexporter.collectors.api.FetchError;
import com.weatherexporter.collectors.api.FetchResult;
import com.weatherexporter.collectors.api.UpstreamClient;
import com.weatherexporter.core.cache.ObservationCache;
import com.weatherexporter.core.model.CacheEntry;
import com.weatherexporter.core.model.Observation;
import com.weatherexporter.service.config.RefreshMode;
import com.weatherexporter.service.metrics.ExporterMetrics;
import io.micrometer.core.instrument.Timer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives upstream fetches and writes successful observations into the cache.
 *
 * <p>In {@link RefreshMode#INTERVAL} mode a single timer thread refreshes at a fixed delay. In
 * {@link RefreshMode#ON_DEMAND} mode {@link #onScrape()} refreshes from the scrape path once the cached
 * entry is older than the freshness threshold. Either way at most one refresh runs at a time: a caller
 * that finds one in flight skips instead of waiting and keeps serving the cached entry. Failures never
 * touch the cache.
 */
public class RefreshScheduler {
    private static final Logger LOGGER = Logger.getLogger(RefreshScheduler.class.getName());

    private final UpstreamClient client;
    private final ObservationCache cache;
    private final ExporterMetrics metrics;
    private final RefreshDiagnostics diagnostics;
    private final Clock clock;
    private final RefreshMode mode;
    private final Duration interval;
    private final Duration freshnessThreshold;
    private final long minIntervalMillis;
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "weather-refresh");
        thread.setDaemon(true);
        return thread;
    });

    public RefreshScheduler(
            UpstreamClient client,
            ObservationCache cache,
            ExporterMetrics metrics,
            RefreshDiagnostics diagnostics,
            Clock clock,
            RefreshMode mode,
            Duration interval,
            Duration freshnessThreshold
    ) {
        this(client, cache, metrics, diagnostics, clock, mode, interval, freshnessThreshold, 1_000);
    }

    RefreshScheduler(
            UpstreamClient client,
            ObservationCache cache,
            ExporterMetrics metrics,
            RefreshDiagnostics diagnostics,
            Clock clock,
            RefreshMode mode,
            Duration interval,
            Duration freshnessThreshold,
            long minIntervalMillis
    ) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.mode = Objects.requireNonNull(mode, "mode is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
        this.freshnessThreshold = Objects.requireNonNull(freshnessThreshold, "freshnessThreshold is required");
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        if (mode != RefreshMode.INTERVAL) {
            LOGGER.info("Refreshing station " + client.stationId() + " on demand when older than " + freshnessThreshold);
            return;
        }
        long intervalMillis = Math.max(minIntervalMillis, interval.toMillis());
        LOGGER.info("Refreshing station " + client.stationId() + " every " + Duration.ofMillis(intervalMillis));
        timerExecutor.scheduleWithFixedDelay(this::scheduledRefresh, 0, intervalMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Hook for the scrape path. Refreshes synchronously in on-demand mode when the cache is empty or stale;
     * does nothing in interval mode.
     */
    public RefreshOutcome onScrape() {
        if (mode != RefreshMode.ON_DEMAND) {
            return RefreshOutcome.NOT_NEEDED;
        }
        Optional<CacheEntry> entry = cache.get();
        if (entry.isPresent() && entry.get().age(clock.instant()).compareTo(freshnessThreshold) < 0) {
            return RefreshOutcome.NOT_NEEDED;
        }
        return refresh();
    }

    public RefreshOutcome refresh() {
        if (!refreshLock.tryLock()) {
            metrics.refreshSkipped();
            return RefreshOutcome.SKIPPED;
        }
        try {
            return refreshLocked();
        } finally {
            refreshLock.unlock();
        }
    }

    void scheduledRefresh() {
        try {
            refresh();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Scheduled refresh of station " + client.stationId() + " failed", e);
        } catch (Error e) {
            // an Error escaping here cancels the fixed-delay task
            LOGGER.log(Level.SEVERE, "Refresh timer for station " + client.stationId() + " stopped", e);
            throw e;
        }
    }

    public void shutdown() {
        timerExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private RefreshOutcome refreshLocked() {
        Instant startedAt = clock.instant();
        diagnostics.attemptStarted(startedAt);
        Timer.Sample sample = metrics.startFetch();
        try {
            FetchResult result = client.fetch();
            long durationMillis = elapsedMillis(startedAt);
            if (!result.success()) {
                FetchError error = result.error();
                metrics.fetchFailed(sample, error.reason());
                diagnostics.failed(clock.instant(), durationMillis, error.reason().label(), error.message());
                LOGGER.warning("Refresh of station " + client.stationId() + " failed (" + error.reason().label() + "): "
                        + error.message() + "; keeping cached observation");
                return RefreshOutcome.FAILED;
            }

            Observation observation = result.observation();
            Instant fetchedAt = clock.instant();
            Optional<CacheEntry> previous = cache.set(observation, fetchedAt);
            previous.ifPresent(old -> warnOnRegression(old.observation(), observation));
            metrics.fetchSucceeded(sample);
            diagnostics.succeeded(fetchedAt, durationMillis);
            LOGGER.fine("Refreshed station " + client.stationId() + ": observedAt=" + observation.observedAt()
                    + " temperature=" + observation.temperature());
            return RefreshOutcome.UPDATED;
        } catch (RuntimeException e) {
            metrics.fetchCrashed(sample);
            diagnostics.failed(clock.instant(), elapsedMillis(startedAt), "internal", String.valueOf(e.getMessage()));
            LOGGER.log(Level.SEVERE, "Refresh of station " + client.stationId() + " crashed; keeping cached observation", e);
            return RefreshOutcome.FAILED;
        }
    }

    private void warnOnRegression(Observation previous, Observation current) {
        if (current.observedAt().isBefore(previous.observedAt())) {
            metrics.observationRegressed();
            LOGGER.warning("Station " + client.stationId() + " reported observation at " + current.observedAt()
                    + ", older than the previous " + previous.observedAt());
        }
    }

    private long elapsedMillis(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    }
}
