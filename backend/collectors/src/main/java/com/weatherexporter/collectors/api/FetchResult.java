package com.weatherexporter.collectors.api;

import com.weatherexporter.core.model.Observation;

public record FetchResult(Observation observation, FetchError error) {
    public FetchResult {
        if ((observation == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of observation or error must be set");
        }
    }

    public static FetchResult success(Observation observation) {
        return new FetchResult(observation, null);
    }

    public static FetchResult failure(FetchError error) {
        return new FetchResult(null, error);
    }

    public static FetchResult failure(FetchErrorReason reason, String message, Throwable cause) {
        return new FetchResult(null, new FetchError(reason, message, cause));
    }

    public boolean success() {
        return observation != null;
    }
}
