package com.scriptplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Publishing platform a script targets.
 *
 * <p>Resolution is lenient: common aliases map onto the canonical platform and any
 * other non-blank value maps to {@link #UNKNOWN}, which scoring treats with a neutral
 * profile. A missing value defaults to {@link #YOUTUBE}.
 */
public enum Platform {
    YOUTUBE("youtube", 45),
    INSTAGRAM("instagram", 35),
    TIKTOK("tiktok", 30),
    UNKNOWN("unknown", 45);

    private static final Map<String, Platform> ALIASES = Map.of(
        "youtube_shorts",  YOUTUBE,
        "youtube_long",    YOUTUBE,
        "shorts",          YOUTUBE,
        "instagram_reels", INSTAGRAM,
        "reels",           INSTAGRAM
    );

    private final String key;
    private final int defaultDurationSeconds;

    Platform(String key, int defaultDurationSeconds) {
        this.key = key;
        this.defaultDurationSeconds = defaultDurationSeconds;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public int defaultDurationSeconds() {
        return defaultDurationSeconds;
    }

    public boolean known() {
        return this != UNKNOWN;
    }

    @JsonCreator
    public static Platform resolve(String value) {
        if (value == null || value.isBlank()) {
            return YOUTUBE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform != UNKNOWN && platform.key.equals(normalized)) {
                return platform;
            }
        }
        return ALIASES.getOrDefault(normalized, UNKNOWN);
    }
}
