package com.scriptplatform.common.scoring;

import com.scriptplatform.common.detector.ScriptText;
import com.scriptplatform.common.model.DetectorResult;
import com.scriptplatform.common.model.ScoreBreakdown;

import java.util.List;

/**
 * Detector rankings and combined breakdown for one script.
 */
public record Evaluation(
    ScriptText script,
    List<DetectorResult> detectorRankings,
    ScoreBreakdown scoreBreakdown
) {
    public Evaluation {
        detectorRankings = List.copyOf(detectorRankings);
    }

    public double combined() {
        return scoreBreakdown.combined();
    }
}
