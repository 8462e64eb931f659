package com.scriptplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FormatType {
    SHORT_FORM("short_form"),
    LONG_FORM("long_form");

    /** Longest duration still treated as short-form content. */
    public static final int SHORT_FORM_MAX_SECONDS = 60;

    private final String key;

    FormatType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public static FormatType of(int durationSeconds) {
        return durationSeconds <= SHORT_FORM_MAX_SECONDS ? SHORT_FORM : LONG_FORM;
    }
}
