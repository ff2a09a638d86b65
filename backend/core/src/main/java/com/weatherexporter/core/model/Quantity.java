package com.weatherexporter.core.model;

/**
 * Physical dimension of an observation field, named after the unit values are normalized to.
 */
public enum Quantity {
    TEMPERATURE("celsius"),
    SPEED("kilometers_per_hour"),
    ANGLE("degrees"),
    PRESSURE("pascals"),
    PERCENT("percent"),
    LENGTH("meters");

    private final String normalizedUnit;

    Quantity(String normalizedUnit) {
        this.normalizedUnit = normalizedUnit;
    }

    public String normalizedUnit() {
        return normalizedUnit;
    }
}
