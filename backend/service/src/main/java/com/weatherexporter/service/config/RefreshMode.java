package com.weatherexporter.service.config;

public enum RefreshMode {
    /** Fetch on a fixed timer, independent of scrapes. */
    INTERVAL,
    /** Fetch from the scrape path once the cached entry is older than the freshness threshold. */
    ON_DEMAND
}
