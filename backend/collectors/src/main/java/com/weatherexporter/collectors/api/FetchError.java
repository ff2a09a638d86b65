package com.weatherexporter.collectors.api;

import java.util.Objects;

public record FetchError(FetchErrorReason reason, String message, Throwable cause) {
    public FetchError {
        Objects.requireNonNull(reason, "reason is required");
        Objects.requireNonNull(message, "message is required");
    }

    public static FetchError of(FetchErrorReason reason, String message) {
        return new FetchError(reason, message, null);
    }
}
