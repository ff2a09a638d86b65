package com.weatherexporter.service;

import com.weatherexporter.collectors.config.StationConfig;
import com.weatherexporter.collectors.weather.StationResolver;
import com.weatherexporter.collectors.weather.WeatherGovClient;
import com.weatherexporter.core.cache.ObservationCache;
import com.weatherexporter.service.api.ExporterServer;
import com.weatherexporter.service.config.ConfigLoader;
import com.weatherexporter.service.config.ExporterConfig;
import com.weatherexporter.service.http.HttpClientFactory;
import com.weatherexporter.service.metrics.ExporterMetrics;
import com.weatherexporter.service.metrics.WeatherMetricsRegistry;
import com.weatherexporter.service.runtime.RefreshDiagnostics;
import com.weatherexporter.service.runtime.RefreshScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of("config");
        ExporterConfig config = ConfigLoader.load(configDir, System.getenv());
        Clock clock = Clock.systemUTC();

        HttpClient sharedHttpClient = HttpClientFactory.create(config.requestTimeout());
        StationResolver resolver = new StationResolver(
                sharedHttpClient,
                config.apiBaseUrl(),
                config.requestTimeout(),
                config.userAgent()
        );
        ExporterMetrics exporterMetrics = new ExporterMetrics();
        bindJvmMetrics(exporterMetrics.registry());
        StationConfig station = resolveStation(config, resolver, exporterMetrics);
        LOGGER.info("Exporting observations for station " + station.stationId() + " from " + station.observationUrl());

        ObservationCache cache = new ObservationCache();
        RefreshDiagnostics diagnostics = new RefreshDiagnostics(clock, station.stationId());
        RefreshScheduler scheduler = new RefreshScheduler(
                new WeatherGovClient(sharedHttpClient, station, exporterMetrics::fieldRejected),
                cache,
                exporterMetrics,
                diagnostics,
                clock,
                config.refreshMode(),
                config.refreshInterval(),
                config.freshnessThreshold()
        );
        ExporterServer server = new ExporterServer(
                config.listenPort(),
                config.httpThreads(),
                cache,
                scheduler,
                new WeatherMetricsRegistry(exporterMetrics, clock),
                exporterMetrics,
                diagnostics
        );

        scheduler.start();
        server.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            server.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    /**
     * Picks the observation source: an explicit URL wins, then a station id, then the station nearest to
     * the configured coordinates.
     */
    static StationConfig resolveStation(ExporterConfig config, StationResolver resolver, ExporterMetrics metrics) {
        if (config.stationUrl() != null) {
            String id = config.stationId() == null ? "custom" : config.stationId();
            return new StationConfig(id, URI.create(config.stationUrl()), config.userAgent(), config.requestTimeout());
        }
        if (config.stationId() != null) {
            return StationConfig.forStation(config.apiBaseUrl(), config.stationId(), config.userAgent(), config.requestTimeout());
        }
        if (config.hasCoordinates()) {
            String stationId = lookupNearestStation(config, resolver, metrics);
            LOGGER.info("Resolved nearest station " + stationId + " for " + config.latitude() + "," + config.longitude());
            return StationConfig.forStation(config.apiBaseUrl(), stationId, config.userAgent(), config.requestTimeout());
        }
        throw new IllegalStateException("No station configured");
    }

    private static String lookupNearestStation(ExporterConfig config, StationResolver resolver, ExporterMetrics metrics) {
        Timer.Sample sample = metrics.startStationLookup();
        try {
            String stationId = resolver.nearestStation(config.latitude(), config.longitude());
            metrics.stationLookupSucceeded(sample);
            return stationId;
        } catch (RuntimeException e) {
            metrics.stationLookupFailed(sample);
            throw e;
        }
    }

    private static void bindJvmMetrics(MeterRegistry registry) {
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new UptimeMetrics().bindTo(registry);
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Failed loading bundled logging.properties: " + e.getMessage());
        }
    }
}
