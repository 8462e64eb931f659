package com.scriptplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Direction of aggregate calibration error inside a drift window.
 *
 * <ul>
 *   <li>{@link #UNDER_PREDICTION}: actual scores land above predictions</li>
 *   <li>{@link #OVER_PREDICTION}: actual scores land below predictions</li>
 *   <li>{@link #NEUTRAL}: mean delta within tolerance</li>
 * </ul>
 */
public enum Bias {
    OVER_PREDICTION,
    UNDER_PREDICTION,
    NEUTRAL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Bias fromKey(String value) {
        return value == null ? NEUTRAL : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
