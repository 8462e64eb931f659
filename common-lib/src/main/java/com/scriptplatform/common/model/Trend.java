package com.scriptplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Trend {
    IMPROVING,
    WORSENING,
    FLAT;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Trend fromKey(String value) {
        return value == null ? FLAT : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
