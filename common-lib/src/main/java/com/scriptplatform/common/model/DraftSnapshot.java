package com.scriptplatform.common.model;

import java.time.Instant;
import java.util.List;

/**
 * A persisted, user-approved draft iteration. Append-only: restoring a snapshot creates
 * new editable state on the client and never touches the stored row.
 */
public record DraftSnapshot(
    Long id,
    Platform platform,
    String sourceItemId,
    String variantId,
    String scriptText,
    Double baselineScore,
    double rescoredScore,
    Double deltaScore,
    List<DetectorResult> detectorRankings,
    List<NextAction> nextActions,
    List<LineLevelEdit> lineLevelEdits,
    ScoreBreakdown scoreBreakdown,
    Instant createdAt
) {
    public DraftSnapshot {
        detectorRankings = detectorRankings == null ? List.of() : List.copyOf(detectorRankings);
        nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
        lineLevelEdits = lineLevelEdits == null ? List.of() : List.copyOf(lineLevelEdits);
    }
}
