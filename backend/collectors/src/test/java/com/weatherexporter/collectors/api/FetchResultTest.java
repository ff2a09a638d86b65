package com.weatherexporter.collectors.api;

import com.weatherexporter.core.model.Observation;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FetchResultTest {
    @Test
    void successCarriesObservationOnly() {
        Observation observation = Observation.builder(Instant.parse("2026-03-04T15:54:00Z")).build();

        FetchResult result = FetchResult.success(observation);

        assertTrue(result.success());
        assertSame(observation, result.observation());
        assertNull(result.error());
    }

    @Test
    void failureCarriesReasonAndCause() {
        IOException cause = new IOException("connection reset");

        FetchResult result = FetchResult.failure(FetchErrorReason.NETWORK, "connection reset", cause);

        assertFalse(result.success());
        assertEquals(FetchErrorReason.NETWORK, result.error().reason());
        assertSame(cause, result.error().cause());
        assertEquals("network", result.error().reason().label());
    }

    @Test
    void rejectsBothOrNeither() {
        Observation observation = Observation.builder(Instant.parse("2026-03-04T15:54:00Z")).build();

        assertThrows(IllegalArgumentException.class, () -> new FetchResult(null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new FetchResult(observation, FetchError.of(FetchErrorReason.PARSE, "bad body")));
    }

    @Test
    void labelsAreLowerCase() {
        assertEquals("bad_status", FetchErrorReason.BAD_STATUS.label());
        assertEquals("timeout", FetchErrorReason.TIMEOUT.label());
    }
}
