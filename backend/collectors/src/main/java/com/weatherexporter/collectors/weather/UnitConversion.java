package com.weatherexporter.collectors.weather;

import com.weatherexporter.core.model.Quantity;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Unit codes weather.gov reports quantities in, with the conversion into each quantity's normalized unit.
 * Codes arrive prefixed, e.g. {@code wmoUnit:degC}; older payloads use {@code unit:degC}.
 */
enum UnitConversion {
    DEG_C("degC", Quantity.TEMPERATURE, value -> value),
    DEG_F("degF", Quantity.TEMPERATURE, value -> (value - 32.0) * 5.0 / 9.0),
    KELVIN("K", Quantity.TEMPERATURE, value -> value - 273.15),
    KM_PER_HOUR("km_h-1", Quantity.SPEED, value -> value),
    M_PER_SECOND("m_s-1", Quantity.SPEED, value -> value * 3.6),
    KNOT("kt", Quantity.SPEED, value -> value * 1.852),
    PASCAL("Pa", Quantity.PRESSURE, value -> value),
    HECTOPASCAL("hPa", Quantity.PRESSURE, value -> value * 100.0),
    PERCENT("percent", Quantity.PERCENT, value -> value),
    DEGREE_ANGLE("degree_(angle)", Quantity.ANGLE, value -> value),
    METER("m", Quantity.LENGTH, value -> value),
    KILOMETER("km", Quantity.LENGTH, value -> value * 1000.0);

    private static final Map<String, UnitConversion> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(UnitConversion::code, Function.identity()));

    private final String code;
    private final Quantity quantity;
    private final DoubleUnaryOperator toNormalized;

    UnitConversion(String code, Quantity quantity, DoubleUnaryOperator toNormalized) {
        this.code = code;
        this.quantity = quantity;
        this.toNormalized = toNormalized;
    }

    String code() {
        return code;
    }

    Quantity quantity() {
        return quantity;
    }

    double toNormalized(double value) {
        return toNormalized.applyAsDouble(value);
    }

    /**
     * Finds the conversion for a unit code, ignoring any namespace prefix before the last colon.
     */
    static Optional<UnitConversion> forUnitCode(String unitCode) {
        if (unitCode == null || unitCode.isBlank()) {
            return Optional.empty();
        }
        String bare = unitCode.substring(unitCode.lastIndexOf(':') + 1).trim();
        return Optional.ofNullable(BY_CODE.get(bare));
    }
}
