package com.weatherexporter.service.runtime;

public enum RefreshOutcome {
    UPDATED,
    FAILED,
    /** Another refresh held the lock; the caller served the cached entry. */
    SKIPPED,
    NOT_NEEDED
}
