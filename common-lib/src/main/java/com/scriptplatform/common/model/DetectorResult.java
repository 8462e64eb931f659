package com.scriptplatform.common.model;

import java.util.List;

/**
 * One detector's verdict on a script.
 *
 * @param detectorKey stable registry key, e.g. {@code hook_strength}
 * @param label       human-readable detector name
 * @param score       0–100, rounded to one decimal
 * @param evidence    ranked reasons behind the score, most important first
 * @param failed      true when the detector threw and {@code score} is its floor
 */
public record DetectorResult(
    String detectorKey,
    String label,
    double score,
    List<String> evidence,
    boolean failed
) {
    public DetectorResult {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
