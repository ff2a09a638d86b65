package com.weatherexporter.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The last successfully fetched observation and the local instant it was fetched at.
 */
public record CacheEntry(Observation observation, Instant fetchedAt) {
    public CacheEntry {
        Objects.requireNonNull(observation, "observation is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
    }

    public Duration age(Instant now) {
        Duration age = Duration.between(fetchedAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }
}
