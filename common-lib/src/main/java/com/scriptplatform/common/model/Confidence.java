package com.scriptplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Data-sufficiency tier attached to combined scores and calibration summaries.
 * {@link #LOW} is a signal, not an error.
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Confidence fromKey(String value) {
        return value == null ? LOW : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
