package com.weatherexporter.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void mapperIsSharedAndLenientOnUnknownProperties() {
        ObjectMapper mapper = JsonUtils.objectMapper();

        assertSame(mapper, JsonUtils.objectMapper());
        assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    void writesNullsAndIsoInstants() throws Exception {
        String json = JsonUtils.objectMapper().writeValueAsString(
                new Status("ok", null, Instant.parse("2026-03-04T16:00:00Z")));
        JsonNode tree = JsonUtils.objectMapper().readTree(json);

        assertTrue(tree.has("lastErrorReason"));
        assertTrue(tree.get("lastErrorReason").isNull());
        assertEquals("2026-03-04T16:00:00Z", tree.get("observedAt").asText());
    }

    @Test
    void readsRecordsIgnoringUnknownFields() throws Exception {
        Status parsed = JsonUtils.objectMapper().readValue(
                "{\"status\":\"degraded\",\"observedAt\":\"2026-03-04T16:00:00Z\",\"extra\":1}",
                Status.class
        );

        assertEquals("degraded", parsed.status());
        assertEquals(Instant.parse("2026-03-04T16:00:00Z"), parsed.observedAt());
    }

    private record Status(String status, String lastErrorReason, Instant observedAt) {
    }
}
