package com.weatherexporter.core.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Objects;

/**
 * One normalized station observation. Quantities are null when the upstream sensor did not report them.
 * Temperatures are in degrees Celsius, speeds in km/h, angles in degrees, pressure in pascals, humidity in
 * percent and visibility in meters.
 */
public record Observation(
        Double temperature,
        Double relativeHumidity,
        Double windSpeed,
        Double windDirection,
        Double barometricPressure,
        Double dewpoint,
        Double windGust,
        Double heatIndex,
        Double windChill,
        Double visibility,
        Instant observedAt
) {
    public Observation {
        Objects.requireNonNull(observedAt, "observedAt is required");
        requireFiniteOrNull("temperature", temperature);
        requireFiniteOrNull("relativeHumidity", relativeHumidity);
        requireFiniteOrNull("windSpeed", windSpeed);
        requireFiniteOrNull("windDirection", windDirection);
        requireFiniteOrNull("barometricPressure", barometricPressure);
        requireFiniteOrNull("dewpoint", dewpoint);
        requireFiniteOrNull("windGust", windGust);
        requireFiniteOrNull("heatIndex", heatIndex);
        requireFiniteOrNull("windChill", windChill);
        requireFiniteOrNull("visibility", visibility);
    }

    public static Builder builder(Instant observedAt) {
        return new Builder(observedAt);
    }

    public Double valueOf(ObservationField field) {
        return switch (field) {
            case TEMPERATURE -> temperature;
            case RELATIVE_HUMIDITY -> relativeHumidity;
            case WIND_SPEED -> windSpeed;
            case WIND_DIRECTION -> windDirection;
            case BAROMETRIC_PRESSURE -> barometricPressure;
            case DEWPOINT -> dewpoint;
            case WIND_GUST -> windGust;
            case HEAT_INDEX -> heatIndex;
            case WIND_CHILL -> windChill;
            case VISIBILITY -> visibility;
        };
    }

    private static void requireFiniteOrNull(String name, Double value) {
        if (value != null && !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite but was " + value);
        }
    }

    public static final class Builder {
        private final Instant observedAt;
        private final EnumMap<ObservationField, Double> values = new EnumMap<>(ObservationField.class);

        private Builder(Instant observedAt) {
            this.observedAt = observedAt;
        }

        public Builder set(ObservationField field, Double value) {
            if (value == null) {
                values.remove(field);
            } else {
                values.put(field, value);
            }
            return this;
        }

        public Observation build() {
            return new Observation(
                    values.get(ObservationField.TEMPERATURE),
                    values.get(ObservationField.RELATIVE_HUMIDITY),
                    values.get(ObservationField.WIND_SPEED),
                    values.get(ObservationField.WIND_DIRECTION),
                    values.get(ObservationField.BAROMETRIC_PRESSURE),
                    values.get(ObservationField.DEWPOINT),
                    values.get(ObservationField.WIND_GUST),
                    values.get(ObservationField.HEAT_INDEX),
                    values.get(ObservationField.WIND_CHILL),
                    values.get(ObservationField.VISIBILITY),
                    observedAt
            );
        }
    }
}
