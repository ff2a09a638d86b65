package com.weatherexporter.collectors.weather;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.weatherexporter.collectors.api.FieldRejectionListener;
import com.weatherexporter.collectors.api.FieldRejectionReason;
import com.weatherexporter.core.model.Observation;
import com.weatherexporter.core.model.ObservationField;
import com.weatherexporter.core.util.JsonUtils;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Turns a weather.gov latest-observation document into a normalized {@link Observation}.
 *
 * <p>Structural problems (not JSON, no {@code properties} object, missing or unreadable {@code timestamp})
 * raise {@link ObservationParseException}, as does a timestamp outside years 1970 to 9999. Problems confined to one quantity (absent, null value, unknown
 * unit, non-numeric value) only leave that field null; all but absence are reported to the
 * {@link FieldRejectionListener}.
 */
public final class ObservationParser {
    private static final Logger LOGGER = Logger.getLogger(ObservationParser.class.getName());
    static final Instant EARLIEST_OBSERVATION = Instant.parse("1970-01-01T00:00:00Z");
    static final Instant LATEST_OBSERVATION = OffsetDateTime.of(9999, 12, 31, 23, 59, 59, 0, ZoneOffset.UTC).toInstant();

    private final FieldRejectionListener rejections;

    public ObservationParser() {
        this(FieldRejectionListener.NONE);
    }

    public ObservationParser(FieldRejectionListener rejections) {
        this.rejections = rejections;
    }

    public Observation parse(String body) {
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new ObservationParseException("Observation payload is not valid JSON", e);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new ObservationParseException("Observation payload is not a JSON object");
        }
        return parse(root);
    }

    public Observation parse(JsonNode root) {
        JsonNode properties = root.path("properties");
        if (!properties.isObject()) {
            throw new ObservationParseException("Observation payload missing properties object");
        }

        Observation.Builder builder = Observation.builder(observedAt(properties));
        for (ObservationField field : ObservationField.values()) {
            builder.set(field, quantity(properties.path(field.payloadKey()), field).orElse(null));
        }
        return builder.build();
    }

    private Instant observedAt(JsonNode properties) {
        String timestamp = properties.path("timestamp").asText("");
        if (timestamp.isBlank()) {
            throw new ObservationParseException("Observation payload missing timestamp");
        }
        Instant observedAt;
        try {
            observedAt = OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException e) {
            throw new ObservationParseException("Observation timestamp is not ISO-8601: " + timestamp, e);
        }
        if (observedAt.isBefore(EARLIEST_OBSERVATION) || observedAt.isAfter(LATEST_OBSERVATION)) {
            throw new ObservationParseException("Observation timestamp out of range: " + timestamp);
        }
        return observedAt;
    }

    Optional<Double> quantity(JsonNode node, ObservationField field) {
        if (!node.isObject()) {
            return Optional.empty();
        }
        JsonNode value = node.path("value");
        if (value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        String unitCode = node.path("unitCode").asText("");
        if (!value.isNumber()) {
            LOGGER.warning("Ignoring non-numeric " + field.payloadKey() + " value: " + value);
            return reject(field, FieldRejectionReason.NON_NUMERIC, unitCode);
        }

        Optional<UnitConversion> conversion = UnitConversion.forUnitCode(unitCode);
        if (conversion.isEmpty()) {
            LOGGER.warning("Ignoring " + field.payloadKey() + " with unsupported unit '" + unitCode + "'");
            return reject(field, FieldRejectionReason.UNSUPPORTED_UNIT, unitCode);
        }
        if (conversion.get().quantity() != field.quantity()) {
            LOGGER.warning("Ignoring " + field.payloadKey() + " reported in '" + unitCode + "', expected a "
                    + field.quantity().normalizedUnit() + " compatible unit");
            return reject(field, FieldRejectionReason.MISMATCHED_UNIT, unitCode);
        }
        double normalized = conversion.get().toNormalized(value.asDouble());
        if (!Double.isFinite(normalized)) {
            return reject(field, FieldRejectionReason.NON_NUMERIC, unitCode);
        }
        return Optional.of(normalized);
    }

    private Optional<Double> reject(ObservationField field, FieldRejectionReason reason, String unitCode) {
        rejections.rejected(field, reason, unitCode);
        return Optional.empty();
    }
}
