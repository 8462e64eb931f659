package com.scriptplatform.common.model;

/**
 * The three score channels combined into one prediction. The key is the name used
 * in persisted weight and sample-count maps.
 */
public enum Channel {
    PLATFORM("platform_metrics"),
    COMPETITOR("competitor_metrics"),
    HISTORICAL("historical_metrics");

    private final String key;

    Channel(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
