package com.weatherexporter.service.metrics;

public class MetricsRenderException extends RuntimeException {
    public MetricsRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
