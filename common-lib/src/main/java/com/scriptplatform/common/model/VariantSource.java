package com.scriptplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Which path produced a script: the external generation backend or the template fallback. */
public enum VariantSource {
    GENERATED,
    FALLBACK;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
