package com.scriptplatform.common.model;

import java.util.List;

/**
 * Output of one rescore pass over an edited draft.
 *
 * <p>{@code scriptFingerprint} identifies the exact text that was scored; the snapshot
 * store only accepts a save whose text produces the same fingerprint.
 */
public record RescoreResult(
    ScoreBreakdown scoreBreakdown,
    List<DetectorResult> detectorRankings,
    List<NextAction> nextActions,
    List<LineLevelEdit> lineLevelEdits,
    ImprovementDiff improvementDiff,
    FormatType formatType,
    int durationSeconds,
    String scriptFingerprint
) {
    /** Number of next actions surfaced by convention. */
    public static final int SURFACED_ACTIONS = 3;

    public RescoreResult {
        detectorRankings = detectorRankings == null ? List.of() : List.copyOf(detectorRankings);
        nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
        lineLevelEdits = lineLevelEdits == null ? List.of() : List.copyOf(lineLevelEdits);
    }

    public List<NextAction> topActions() {
        return nextActions.subList(0, Math.min(SURFACED_ACTIONS, nextActions.size()));
    }
}
