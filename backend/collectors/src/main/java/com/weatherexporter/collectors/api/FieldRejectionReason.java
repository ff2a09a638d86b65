package com.weatherexporter.collectors.api;

import java.util.Locale;

/**
 * Why a reported quantity was left out of an otherwise usable observation.
 */
public enum FieldRejectionReason {
    NON_NUMERIC,
    UNSUPPORTED_UNIT,
    MISMATCHED_UNIT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
