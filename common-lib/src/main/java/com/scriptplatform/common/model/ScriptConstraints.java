package com.scriptplatform.common.model;

import java.util.Locale;

/**
 * Read-only constraints a script is evaluated against.
 *
 * @param platform        target platform ({@link Platform#UNKNOWN} scores with a neutral profile)
 * @param durationSeconds planned runtime, clamped to [{@value #MIN_DURATION_SECONDS}, {@value #MAX_DURATION_SECONDS}]
 * @param tone            declared tone, lower-case; unrecognised tones apply no adjustment
 * @param hookStyle       optional hook style override (question / proof / number)
 * @param ctaStyle        optional CTA style override (comment_prompt / subscribe_follow / save_share / link_bio)
 * @param pacingDensity   optional pacing override (low / high)
 */
public record ScriptConstraints(
    Platform platform,
    int durationSeconds,
    String tone,
    String hookStyle,
    String ctaStyle,
    String pacingDensity
) {
    public static final int MIN_DURATION_SECONDS = 15;
    public static final int MAX_DURATION_SECONDS = 900;
    public static final String DEFAULT_TONE = "bold";

    public ScriptConstraints {
        platform = platform == null ? Platform.YOUTUBE : platform;
        durationSeconds = Math.max(MIN_DURATION_SECONDS, Math.min(MAX_DURATION_SECONDS, durationSeconds));
        tone = normalize(tone);
        if (tone == null) {
            tone = DEFAULT_TONE;
        }
        hookStyle = normalize(hookStyle);
        ctaStyle = normalize(ctaStyle);
        pacingDensity = normalize(pacingDensity);
    }

    /**
     * Builds constraints from raw request values, filling the platform default
     * duration when none was supplied.
     */
    public static ScriptConstraints of(String platform, Integer durationSeconds, String tone,
                                       String hookStyle, String ctaStyle, String pacingDensity) {
        Platform resolved = Platform.resolve(platform);
        int duration = durationSeconds != null ? durationSeconds : resolved.defaultDurationSeconds();
        return new ScriptConstraints(resolved, duration, tone, hookStyle, ctaStyle, pacingDensity);
    }

    public static ScriptConstraints of(String platform, Integer durationSeconds) {
        return of(platform, durationSeconds, null, null, null, null);
    }

    public FormatType formatType() {
        return FormatType.of(durationSeconds);
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
