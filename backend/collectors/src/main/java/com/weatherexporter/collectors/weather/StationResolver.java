package com.weatherexporter.collectors.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherexporter.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Looks up the observation station nearest to a coordinate via the weather.gov points API. Only used at
 * startup, so failures are thrown rather than reported as values.
 */
public final class StationResolver {
    private static final Logger LOGGER = Logger.getLogger(StationResolver.class.getName());

    private final HttpClient httpClient;
    private final String apiBaseUrl;
    private final Duration timeout;
    private final String userAgent;

    public StationResolver(HttpClient httpClient, String apiBaseUrl, Duration timeout, String userAgent) {
        this.httpClient = httpClient;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    public String nearestStation(double latitude, double longitude) {
        try {
            // weather.gov rejects coordinates with more than four decimals
            String point = String.format(Locale.ROOT, "%.4f,%.4f", latitude, longitude);
            JsonNode points = getJson(URI.create(apiBaseUrl + "/points/" + point));
            String stationsUrl = points.path("properties").path("observationStations").asText("");
            if (stationsUrl.isBlank()) {
                throw new IllegalStateException("Points response for " + point + " has no observationStations URL");
            }
            JsonNode stations = getJson(URI.create(stationsUrl));
            JsonNode features = stations.path("features");
            if (!features.isArray() || features.isEmpty()) {
                throw new IllegalStateException("No observation stations listed for " + point);
            }
            String stationId = features.get(0).path("properties").path("stationIdentifier").asText("");
            if (stationId.isBlank()) {
                throw new IllegalStateException("Nearest station for " + point + " has no stationIdentifier");
            }
            LOGGER.info("Resolved " + point + " to station " + stationId);
            return stationId;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Station lookup interrupted for " + latitude + "," + longitude, e);
        } catch (IOException e) {
            throw new IllegalStateException("Station lookup failed for " + latitude + "," + longitude, e);
        }
    }

    private JsonNode getJson(URI uri) throws IOException, InterruptedException {
        int attempts = 0;
        while (true) {
            attempts++;
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(timeout)
                    .header("Accept", "application/geo+json, application/json")
                    .header("User-Agent", userAgent)
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 == 2) {
                return JsonUtils.objectMapper().readTree(response.body());
            }
            if (attempts >= 2 || response.statusCode() < 500) {
                throw new IllegalStateException("weather.gov request failed with status " + response.statusCode() + " for " + uri);
            }
        }
    }
}
