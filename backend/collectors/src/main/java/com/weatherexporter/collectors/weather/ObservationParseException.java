package com.weatherexporter.collectors.weather;

public class ObservationParseException extends RuntimeException {
    public ObservationParseException(String message) {
        super(message);
    }

    public ObservationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
