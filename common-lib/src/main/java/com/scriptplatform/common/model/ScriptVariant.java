package com.scriptplatform.common.model;

import java.util.List;

/**
 * One ranked candidate of a generation batch. Immutable once created; later snapshots
 * reference it by {@code id} only.
 *
 * @param rank               1..n, unique within the batch, by descending combined score
 * @param expectedLiftPoints combined-score gain over the naive no-template baseline, never negative
 */
public record ScriptVariant(
    String id,
    int rank,
    String styleKey,
    String label,
    String rationale,
    String scriptText,
    int durationSeconds,
    List<DetectorResult> detectorRankings,
    ScoreBreakdown scoreBreakdown,
    double expectedLiftPoints,
    VariantSource source
) {
    public ScriptVariant {
        detectorRankings = detectorRankings == null ? List.of() : List.copyOf(detectorRankings);
    }
}
