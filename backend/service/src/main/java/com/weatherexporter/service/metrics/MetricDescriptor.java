package com.weatherexporter.service.metrics;

import com.weatherexporter.core.model.ObservationField;
import io.micrometer.core.instrument.Meter;
import io.micrometer.prometheus.PrometheusNamingConvention;

import java.util.List;
import java.util.Objects;

/**
 * Binds one observation field to the gauge it is exported as. {@code name} is the Micrometer meter name;
 * the Prometheus naming convention appends {@code baseUnit} when rendering.
 */
public record MetricDescriptor(ObservationField field, String name, String help, String baseUnit) {
    private static final PrometheusNamingConvention NAMING = new PrometheusNamingConvention();

    public static final List<MetricDescriptor> WEATHER = List.of(
            new MetricDescriptor(ObservationField.TEMPERATURE, "weather.temperature",
                    "Air temperature at the station in degrees Celsius."),
            new MetricDescriptor(ObservationField.RELATIVE_HUMIDITY, "weather.relative.humidity",
                    "Relative humidity at the station in percent."),
            new MetricDescriptor(ObservationField.WIND_SPEED, "weather.wind.speed",
                    "Sustained wind speed at the station in kilometers per hour."),
            new MetricDescriptor(ObservationField.WIND_DIRECTION, "weather.wind.direction",
                    "Direction the wind blows from, in degrees clockwise from true north."),
            new MetricDescriptor(ObservationField.BAROMETRIC_PRESSURE, "weather.barometric.pressure",
                    "Station barometric pressure in pascals."),
            new MetricDescriptor(ObservationField.DEWPOINT, "weather.dewpoint",
                    "Dewpoint temperature at the station in degrees Celsius."),
            new MetricDescriptor(ObservationField.WIND_GUST, "weather.wind.gust",
                    "Peak wind gust at the station in kilometers per hour."),
            new MetricDescriptor(ObservationField.HEAT_INDEX, "weather.heat.index",
                    "Heat index at the station in degrees Celsius."),
            new MetricDescriptor(ObservationField.WIND_CHILL, "weather.wind.chill",
                    "Wind chill at the station in degrees Celsius."),
            new MetricDescriptor(ObservationField.VISIBILITY, "weather.visibility",
                    "Horizontal visibility at the station in meters.")
    );

    public MetricDescriptor {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(help, "help is required");
        Objects.requireNonNull(baseUnit, "baseUnit is required");
    }

    private MetricDescriptor(ObservationField field, String name, String help) {
        this(field, name, help, field.quantity().normalizedUnit());
    }

    /**
     * Name of the sample line in the exposition output.
     */
    public String exportedName() {
        return NAMING.name(name, Meter.Type.GAUGE, baseUnit);
    }
}
