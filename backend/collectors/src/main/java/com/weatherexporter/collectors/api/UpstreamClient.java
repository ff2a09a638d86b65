package com.weatherexporter.collectors.api;

/**
 * Fetches the latest observation for the configured station. Implementations perform a single bounded
 * request per call and never retry; failures are reported in the result rather than thrown.
 */
public interface UpstreamClient {
    String stationId();

    FetchResult fetch();
}
