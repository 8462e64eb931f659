package com.scriptplatform.common.variant;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Creative angles a batch draws from, in catalogue order.
 */
public enum VariantStyle {
    OUTCOME_PROOF("variant_a", "Outcome + Proof",
        "Best for direct authority and fast proof.",
        "lead with a concrete claim and its evidence in the first line"),
    CURIOSITY_GAP("variant_b", "Curiosity Gap",
        "Best for curiosity-driven retention and completion.",
        "open a loop in the first two lines, then close it with proof"),
    CONTRARIAN("variant_c", "Contrarian Take",
        "Best for differentiated positioning and share triggers.",
        "challenge common advice and present a clear alternative"),
    COUNTDOWN("variant_d", "Countdown List",
        "Best for scannable value and rewatch loops.",
        "count down numbered points with the strongest one last"),
    STORY_ARC("variant_e", "Story Arc",
        "Best for relatability and emotional pull.",
        "tell a short before/after story with one measurable turn");

    public static final int MAX_VARIANTS = values().length;
    public static final int DEFAULT_VARIANTS = 3;

    private final String key;
    private final String label;
    private final String rationale;
    private final String instruction;

    VariantStyle(String key, String label, String rationale, String instruction) {
        this.key = key;
        this.label = label;
        this.rationale = rationale;
        this.instruction = instruction;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public String rationale() {
        return rationale;
    }

    /** Brief for an external generation backend. */
    public String instruction() {
        return instruction;
    }

    public static List<VariantStyle> first(int count) {
        return Arrays.asList(values()).subList(0, Math.max(0, Math.min(count, MAX_VARIANTS)));
    }

    public static Optional<VariantStyle> fromKey(String key) {
        return Arrays.stream(values()).filter(style -> style.key.equals(key)).findFirst();
    }
}
