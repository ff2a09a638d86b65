package com.weatherexporter.core.model;

public enum ObservationField {
    TEMPERATURE("temperature", Quantity.TEMPERATURE),
    RELATIVE_HUMIDITY("relativeHumidity", Quantity.PERCENT),
    WIND_SPEED("windSpeed", Quantity.SPEED),
    WIND_DIRECTION("windDirection", Quantity.ANGLE),
    BAROMETRIC_PRESSURE("barometricPressure", Quantity.PRESSURE),
    DEWPOINT("dewpoint", Quantity.TEMPERATURE),
    WIND_GUST("windGust", Quantity.SPEED),
    HEAT_INDEX("heatIndex", Quantity.TEMPERATURE),
    WIND_CHILL("windChill", Quantity.TEMPERATURE),
    VISIBILITY("visibility", Quantity.LENGTH);

    private final String payloadKey;
    private final Quantity quantity;

    ObservationField(String payloadKey, Quantity quantity) {
        this.payloadKey = payloadKey;
        this.quantity = quantity;
    }

    /**
     * Property name of this field in a weather.gov observation payload.
     */
    public String payloadKey() {
        return payloadKey;
    }

    public Quantity quantity() {
        return quantity;
    }
}
