package com.weatherexporter.service.api;

import com.weatherexporter.core.cache.ObservationCache;
import com.weatherexporter.core.util.JsonUtils;
import com.weatherexporter.service.metrics.ExporterMetrics;
import com.weatherexporter.service.metrics.MetricsRenderException;
import com.weatherexporter.service.metrics.WeatherMetricsRegistry;
import com.weatherexporter.service.runtime.RefreshDiagnostics;
import com.weatherexporter.service.runtime.RefreshScheduler;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves the Prometheus scrape endpoint on {@code /} (aliased as {@code /metrics}) and a JSON refresh
 * status on {@code /health}. Scrapes only read the cache; in on-demand mode they may first trigger a
 * refresh through the scheduler.
 */
public class ExporterServer {
    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private static final Logger LOGGER = Logger.getLogger(ExporterServer.class.getName());

    private final int port;
    private final int threads;
    private final ObservationCache cache;
    private final RefreshScheduler scheduler;
    private final WeatherMetricsRegistry registry;
    private final ExporterMetrics metrics;
    private final RefreshDiagnostics diagnostics;

    private HttpServer server;
    private ExecutorService executor;

    public ExporterServer(
            int port,
            int threads,
            ObservationCache cache,
            RefreshScheduler scheduler,
            WeatherMetricsRegistry registry,
            ExporterMetrics metrics,
            RefreshDiagnostics diagnostics
    ) {
        this.port = port;
        this.threads = threads;
        this.cache = cache;
        this.scheduler = scheduler;
        this.registry = registry;
        this.metrics = metrics;
        this.diagnostics = diagnostics;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(threads);
            server.setExecutor(executor);
            server.createContext("/", this::handleRoot);
            server.createContext("/metrics", this::handleMetrics);
            server.createContext("/health", this::handleHealth);
            server.start();
            LOGGER.info("Exporter listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting exporter server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdown();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleRoot(HttpExchange exchange) throws IOException {
        // "/" is the catch-all context
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            writeText(exchange, 404, "text/plain; charset=utf-8", "not found\n");
            return;
        }
        handleMetrics(exchange);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureReadMethod(exchange)) {
            return;
        }
        scheduler.onScrape();
        String body;
        try {
            body = registry.render(cache.get());
        } catch (MetricsRenderException e) {
            LOGGER.log(Level.SEVERE, "Failed rendering metrics for " + exchange.getRequestURI(), e);
            metrics.scrapeServed(500);
            writeText(exchange, 500, "text/plain; charset=utf-8", "failed rendering metrics\n");
            return;
        }
        metrics.scrapeServed(200);
        writeText(exchange, 200, CONTENT_TYPE, body);
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureReadMethod(exchange)) {
            return;
        }
        writeJson(exchange, 200, diagnostics.snapshot(cache.get()));
    }

    private boolean ensureReadMethod(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        if ("GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method)) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", "GET, HEAD");
        exchange.sendResponseHeaders(405, -1);
        exchange.close();
        return false;
    }

    private void writeText(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        write(exchange, status, contentType, body.getBytes(StandardCharsets.UTF_8));
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        write(exchange, status, "application/json", JsonUtils.objectMapper().writeValueAsBytes(body));
    }

    private void write(HttpExchange exchange, int status, String contentType, byte[] payload) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        if ("HEAD".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }
}
