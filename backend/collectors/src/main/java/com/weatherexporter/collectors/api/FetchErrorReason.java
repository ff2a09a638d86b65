package com.weatherexporter.collectors.api;

import java.util.Locale;

public enum FetchErrorReason {
    NETWORK,
    TIMEOUT,
    BAD_STATUS,
    PARSE;

    /**
     * Lower-case form used for metric labels and logs.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
