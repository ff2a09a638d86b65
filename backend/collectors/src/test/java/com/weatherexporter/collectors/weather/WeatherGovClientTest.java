package com.weatherexporter.collectors.weather;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import com.weatherexporter.collectors.api.FetchErrorReason;
import com.weatherexporter.collectors.api.FetchResult;
import com.weatherexporter.collectors.config.StationConfig;
import com.weatherexporter.collectors.support.FixtureUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeatherGovClientTest {
    private static final String USER_AGENT = "weather-exporter-test (ops@example.com)";

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void fetchesAndNormalizesLatestObservation() throws Exception {
        AtomicReference<String> requestedPath = new AtomicReference<>();
        AtomicReference<String> userAgent = new AtomicReference<>();
        AtomicReference<String> accept = new AtomicReference<>();
        startServer(exchange -> {
            requestedPath.set(exchange.getRequestURI().getPath());
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            accept.set(exchange.getRequestHeaders().getFirst("Accept"));
            writeResponse(exchange, 200, FixtureUtils.readFixture("fixtures/observation-latest.json"));
        });

        FetchResult result = client("KBOS", Duration.ofSeconds(2)).fetch();

        assertTrue(result.success());
        assertNull(result.error());
        assertEquals(7.2, result.observation().temperature());
        assertEquals(Instant.parse("2026-03-04T15:54:00Z"), result.observation().observedAt());
        assertEquals("/stations/KBOS/observations/latest", requestedPath.get());
        assertEquals(USER_AGENT, userAgent.get());
        assertTrue(accept.get().contains("application/geo+json"));
    }

    @Test
    void nonSuccessStatusIsBadStatus() throws Exception {
        startServer(exchange -> writeResponse(exchange, 403, "{\"title\":\"Forbidden\",\"detail\":\"Missing User-Agent\"}"));

        FetchResult result = client("KBOS", Duration.ofSeconds(2)).fetch();

        assertFalse(result.success());
        assertEquals(FetchErrorReason.BAD_STATUS, result.error().reason());
        assertTrue(result.error().message().contains("403"));
    }

    @Test
    void serverErrorIsNotRetried() throws Exception {
        AtomicInteger hits = new AtomicInteger();
        startServer(exchange -> {
            hits.incrementAndGet();
            writeResponse(exchange, 503, "unavailable");
        });

        FetchResult result = client("KBOS", Duration.ofSeconds(2)).fetch();

        assertEquals(FetchErrorReason.BAD_STATUS, result.error().reason());
        assertEquals(1, hits.get());
    }

    @Test
    void malformedBodyIsParseError() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, "<html>maintenance</html>"));

        FetchResult result = client("KBOS", Duration.ofSeconds(2)).fetch();

        assertEquals(FetchErrorReason.PARSE, result.error().reason());
    }

    @Test
    void missingTimestampIsParseError() throws Exception {
        startServer(exchange -> writeResponse(exchange, 200, "{\"properties\":{}}"));

        FetchResult result = client("KBOS", Duration.ofSeconds(2)).fetch();

        assertEquals(FetchErrorReason.PARSE, result.error().reason());
        assertTrue(result.error().message().contains("timestamp"));
    }

    @Test
    void slowUpstreamIsTimeout() throws Exception {
        startServer(exchange -> {
            try {
                Thread.sleep(1_500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            writeResponse(exchange, 200, FixtureUtils.readFixture("fixtures/observation-latest.json"));
        });

        FetchResult result = client("KBOS", Duration.ofMillis(200)).fetch();

        assertEquals(FetchErrorReason.TIMEOUT, result.error().reason());
    }

    @Test
    void refusedConnectionIsNetworkError() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        StationConfig station = new StationConfig(
                "KBOS",
                URI.create("http://127.0.0.1:" + closedPort + "/stations/KBOS/observations/latest"),
                USER_AGENT,
                Duration.ofSeconds(2)
        );

        FetchResult result = new WeatherGovClient(HttpClient.newHttpClient(), station).fetch();

        assertEquals(FetchErrorReason.NETWORK, result.error().reason());
        assertNotNull(result.error().cause());
    }

    private WeatherGovClient client(String stationId, Duration timeout) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        return new WeatherGovClient(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
                StationConfig.forStation(baseUrl, stationId, USER_AGENT, timeout)
        );
    }

    private void startServer(HttpHandler handler) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", handler);
        server.start();
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/geo+json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
