package com.weatherexporter.collectors.weather;

import com.weatherexporter.collectors.api.FetchErrorReason;
import com.weatherexporter.collectors.api.FieldRejectionListener;
import com.weatherexporter.collectors.api.FetchResult;
import com.weatherexporter.collectors.api.UpstreamClient;
import com.weatherexporter.collectors.config.StationConfig;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class WeatherGovClient implements UpstreamClient {
    private static final Logger LOGGER = Logger.getLogger(WeatherGovClient.class.getName());

    private final HttpClient httpClient;
    private final StationConfig station;
    private final ObservationParser parser;

    public WeatherGovClient(HttpClient httpClient, StationConfig station) {
        this(httpClient, station, new ObservationParser());
    }

    public WeatherGovClient(HttpClient httpClient, StationConfig station, FieldRejectionListener rejections) {
        this(httpClient, station, new ObservationParser(rejections));
    }

    WeatherGovClient(HttpClient httpClient, StationConfig station, ObservationParser parser) {
        this.httpClient = httpClient;
        this.station = station;
        this.parser = parser;
    }

    @Override
    public String stationId() {
        return station.stationId();
    }

    @Override
    public FetchResult fetch() {
        HttpRequest request = HttpRequest.newBuilder(station.observationUrl())
                .GET()
                .timeout(station.requestTimeout())
                .header("Accept", "application/geo+json, application/json")
                .header("User-Agent", station.userAgent())
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            return FetchResult.failure(FetchErrorReason.TIMEOUT,
                    "Request to " + station.observationUrl() + " timed out after " + station.requestTimeout(), e);
        } catch (IOException e) {
            return FetchResult.failure(FetchErrorReason.NETWORK,
                    "Request to " + station.observationUrl() + " failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(FetchErrorReason.NETWORK, "Request to " + station.observationUrl() + " was interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            return FetchResult.failure(FetchErrorReason.BAD_STATUS,
                    "Upstream returned status " + response.statusCode() + " for " + station.observationUrl(), null);
        }

        try {
            return FetchResult.success(parser.parse(response.body()));
        } catch (ObservationParseException | IllegalArgumentException e) {
            LOGGER.log(Level.FINE, "Unparseable observation body from " + station.observationUrl(), e);
            return FetchResult.failure(FetchErrorReason.PARSE,
                    "Unparseable observation from " + station.observationUrl() + ": " + e.getMessage(), e);
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
