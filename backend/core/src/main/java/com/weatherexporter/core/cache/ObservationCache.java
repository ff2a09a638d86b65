package com.weatherexporter.core.cache;

import com.weatherexporter.core.model.CacheEntry;
import com.weatherexporter.core.model.Observation;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-slot holder for the latest successful observation. Empty until the first successful fetch;
 * afterwards every {@link #set} supersedes the previous entry in one atomic swap, so readers see either
 * the old entry or the new one, never a mix. Entries never expire here.
 */
public final class ObservationCache {
    private final AtomicReference<CacheEntry> current = new AtomicReference<>();

    public Optional<CacheEntry> get() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Replaces the live entry and returns the one it superseded, if any.
     */
    public Optional<CacheEntry> set(Observation observation, Instant fetchedAt) {
        return Optional.ofNullable(current.getAndSet(new CacheEntry(observation, fetchedAt)));
    }
}
