package com.weatherexporter.collectors.weather;

import com.weatherexporter.collectors.api.FieldRejectionReason;
import com.weatherexporter.collectors.support.FixtureUtils;
import com.weatherexporter.core.model.Observation;
import com.weatherexporter.core.model.ObservationField;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObservationParserTest {
    private final ObservationParser parser = new ObservationParser();

    @Test
    void parsesMetricPayloadWithoutConversion() {
        Observation observation = parser.parse(FixtureUtils.readFixture("fixtures/observation-latest.json"));

        assertEquals(Instant.parse("2026-03-04T15:54:00Z"), observation.observedAt());
        assertEquals(7.2, observation.temperature());
        assertEquals(55.47, observation.relativeHumidity());
        assertEquals(24.084, observation.windSpeed());
        assertEquals(250.0, observation.windDirection());
        assertEquals(101250.0, observation.barometricPressure());
        assertEquals(-1.1, observation.dewpoint());
        assertEquals(38.88, observation.windGust());
        assertEquals(2.9, observation.windChill());
        assertEquals(16090.0, observation.visibility());
        assertNull(observation.heatIndex());
    }

    @Test
    void convertsImperialAndAlternateUnits() {
        Observation observation = parser.parse(FixtureUtils.readFixture("fixtures/observation-imperial.json"));

        assertEquals(0.0, observation.temperature(), 0.01);
        assertEquals(100.0, observation.dewpoint(), 0.01);
        assertEquals(36.0, observation.windSpeed(), 1e-9);
        assertEquals(18.52, observation.windGust(), 1e-9);
        assertEquals(101325.0, observation.barometricPressure(), 1e-6);
        assertEquals(16000.0, observation.visibility(), 1e-9);
        assertEquals(0.0, observation.windChill(), 1e-9);
        assertEquals(Instant.parse("2026-01-15T11:00:00Z"), observation.observedAt());
    }

    @Test
    void fahrenheitBoilingAndBodyTemperaturesConvert() {
        assertEquals(100.0, UnitConversion.DEG_F.toNormalized(212.0), 0.01);
        assertEquals(37.0, UnitConversion.DEG_F.toNormalized(98.6), 0.01);
        assertEquals(-40.0, UnitConversion.DEG_F.toNormalized(-40.0), 0.01);
    }

    @Test
    void missingNullUnknownUnitAndMismatchedQuantityBecomeNull() {
        Observation observation = parser.parse(FixtureUtils.readFixture("fixtures/observation-sparse.json"));

        assertEquals(6.1, observation.temperature());
        assertNull(observation.relativeHumidity(), "null value");
        assertNull(observation.windSpeed(), "unknown unit code");
        assertNull(observation.windDirection(), "non-numeric value");
        assertNull(observation.barometricPressure(), "temperature unit on a pressure field");
        assertNull(observation.visibility(), "absent from payload");
    }

    @Test
    void reportsRejectedFieldsWithReasonAndUnit() {
        List<String> rejected = new ArrayList<>();
        ObservationParser reporting = new ObservationParser(
                (field, reason, unitCode) -> rejected.add(field + "/" + reason + "/" + unitCode));

        reporting.parse(FixtureUtils.readFixture("fixtures/observation-sparse.json"));

        assertEquals(List.of(
                ObservationField.WIND_SPEED + "/" + FieldRejectionReason.UNSUPPORTED_UNIT + "/wmoUnit:furlong_fortnight-1",
                ObservationField.WIND_DIRECTION + "/" + FieldRejectionReason.NON_NUMERIC + "/wmoUnit:degree_(angle)",
                ObservationField.BAROMETRIC_PRESSURE + "/" + FieldRejectionReason.MISMATCHED_UNIT + "/wmoUnit:degC"
        ), rejected);
    }

    @Test
    void cleanPayloadReportsNoRejections() {
        List<ObservationField> rejected = new ArrayList<>();
        ObservationParser reporting = new ObservationParser((field, reason, unitCode) -> rejected.add(field));

        reporting.parse(FixtureUtils.readFixture("fixtures/observation-latest.json"));

        assertTrue(rejected.isEmpty(), rejected.toString());
    }

    @Test
    void timestampsOutsideSupportedYearsAreParseErrors() {
        ObservationParseException farFuture = assertThrows(
                ObservationParseException.class,
                () -> parser.parse("{\"properties\":{\"timestamp\":\"+999999999-12-31T00:00:00Z\"}}")
        );
        assertTrue(farFuture.getMessage().contains("out of range"));
        assertThrows(
                ObservationParseException.class,
                () -> parser.parse("{\"properties\":{\"timestamp\":\"1969-12-31T23:59:59Z\"}}")
        );

        Observation latest = parser.parse("{\"properties\":{\"timestamp\":\"9999-12-31T23:59:59Z\"}}");
        assertEquals(Instant.parse("9999-12-31T23:59:59Z"), latest.observedAt());
    }

    @Test
    void structuralProblemsRaiseParseException() {
        assertThrows(ObservationParseException.class, () -> parser.parse("{not json"));
        assertThrows(ObservationParseException.class, () -> parser.parse(""));
        assertThrows(ObservationParseException.class, () -> parser.parse("[1,2,3]"));
        assertThrows(ObservationParseException.class, () -> parser.parse("{\"type\":\"Feature\"}"));

        ObservationParseException noTimestamp = assertThrows(
                ObservationParseException.class,
                () -> parser.parse("{\"properties\":{\"temperature\":{\"unitCode\":\"wmoUnit:degC\",\"value\":3}}}")
        );
        assertTrue(noTimestamp.getMessage().contains("timestamp"));

        assertThrows(
                ObservationParseException.class,
                () -> parser.parse("{\"properties\":{\"timestamp\":\"yesterday\"}}")
        );
    }

    @Test
    void unitCodeLookupIgnoresNamespace() {
        assertEquals(UnitConversion.DEG_C, UnitConversion.forUnitCode("wmoUnit:degC").orElseThrow());
        assertEquals(UnitConversion.DEG_C, UnitConversion.forUnitCode("unit:degC").orElseThrow());
        assertEquals(UnitConversion.PASCAL, UnitConversion.forUnitCode("Pa").orElseThrow());
        assertTrue(UnitConversion.forUnitCode("wmoUnit:lightyear").isEmpty());
        assertTrue(UnitConversion.forUnitCode(null).isEmpty());
    }
}
