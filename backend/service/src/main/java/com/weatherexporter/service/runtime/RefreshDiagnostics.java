package com.weatherexporter.service.runtime;

import com.weatherexporter.core.model.CacheEntry;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks the outcome of recent refreshes for the health endpoint.
 */
public final class RefreshDiagnostics {
    private final Clock clock;
    private final String stationId;
    private final AtomicReference<RefreshStatus> status = new AtomicReference<>(RefreshStatus.empty());

    public RefreshDiagnostics(Clock clock, String stationId) {
        this.clock = clock;
        this.stationId = stationId;
    }

    void attemptStarted(Instant at) {
        status.updateAndGet(current -> current.withAttemptAt(at));
    }

    void succeeded(Instant at, long durationMillis) {
        status.updateAndGet(current -> current.withSuccess(at, durationMillis));
    }

    void failed(Instant at, long durationMillis, String reason, String message) {
        status.updateAndGet(current -> current.withFailure(at, durationMillis, reason, message));
    }

    public int consecutiveFailures() {
        return status.get().consecutiveFailures();
    }

    public Optional<String> lastErrorReason() {
        return Optional.ofNullable(status.get().lastErrorReason());
    }

    public Map<String, Object> snapshot(Optional<CacheEntry> entry) {
        RefreshStatus current = status.get();
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("status", health(current, entry));
        snapshot.put("station", stationId);
        snapshot.put("lastAttemptAt", current.lastAttemptAt() == null ? null : current.lastAttemptAt().toString());
        snapshot.put("lastSuccessAt", current.lastSuccessAt() == null ? null : current.lastSuccessAt().toString());
        snapshot.put("lastFailureAt", current.lastFailureAt() == null ? null : current.lastFailureAt().toString());
        snapshot.put("lastDurationMillis", current.lastDurationMillis());
        snapshot.put("lastErrorReason", current.lastErrorReason());
        snapshot.put("lastErrorMessage", current.lastErrorMessage());
        snapshot.put("consecutiveFailures", current.consecutiveFailures());
        snapshot.put("observedAt", entry.map(e -> e.observation().observedAt().toString()).orElse(null));
        snapshot.put("cacheAgeSeconds", entry.map(e -> e.age(clock.instant()).toSeconds()).orElse(null));
        return snapshot;
    }

    private static String health(RefreshStatus current, Optional<CacheEntry> entry) {
        if (entry.isEmpty()) {
            return current.lastAttemptAt() == null ? "starting" : "no_data";
        }
        return current.consecutiveFailures() > 0 ? "degraded" : "ok";
    }

    private record RefreshStatus(
            Instant lastAttemptAt,
            Instant lastSuccessAt,
            Instant lastFailureAt,
            Long lastDurationMillis,
            String lastErrorReason,
            String lastErrorMessage,
            int consecutiveFailures
    ) {
        private static RefreshStatus empty() {
            return new RefreshStatus(null, null, null, null, null, null, 0);
        }

        private RefreshStatus withAttemptAt(Instant at) {
            return new RefreshStatus(at, lastSuccessAt, lastFailureAt, lastDurationMillis, lastErrorReason, lastErrorMessage, consecutiveFailures);
        }

        private RefreshStatus withSuccess(Instant at, long durationMillis) {
            return new RefreshStatus(lastAttemptAt, at, lastFailureAt, durationMillis, null, null, 0);
        }

        private RefreshStatus withFailure(Instant at, long durationMillis, String reason, String message) {
            return new RefreshStatus(lastAttemptAt, lastSuccessAt, at, durationMillis, reason, message, consecutiveFailures + 1);
        }
    }
}
