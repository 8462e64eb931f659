package com.scriptplatform.common.rescore;

import com.scriptplatform.common.exception.ValidationException;
import com.scriptplatform.common.model.ChannelContext;
import com.scriptplatform.common.model.DetectorDelta;
import com.scriptplatform.common.model.DetectorResult;
import com.scriptplatform.common.model.ImprovementDiff;
import com.scriptplatform.common.model.RescoreResult;
import com.scriptplatform.common.model.ScriptConstraints;
import com.scriptplatform.common.model.Scores;
import com.scriptplatform.common.scoring.Evaluation;
import com.scriptplatform.common.scoring.ScriptEvaluator;
import com.scriptplatform.common.scoring.ScriptFingerprint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-evaluates an edited draft and diffs it against an optional baseline.
 *
 * <p>Pure: the result is ephemeral until the caller saves it as a snapshot.
 */
public final class Rescorer {

    public static final int MIN_SCRIPT_LENGTH = 20;

    private final ScriptEvaluator evaluator;

    public Rescorer(ScriptEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * @param baselineScore            combined score before the edit, or {@code null}
     * @param baselineDetectorRankings detector results before the edit, or {@code null}
     * @throws ValidationException when the text is blank or shorter than {@value #MIN_SCRIPT_LENGTH} characters
     */
    public RescoreResult rescore(String scriptText,
                                 ScriptConstraints constraints,
                                 Double baselineScore,
                                 List<DetectorResult> baselineDetectorRankings,
                                 ChannelContext context) {
        if (scriptText == null || scriptText.isBlank()) {
            throw new ValidationException("rescore", "script_text is required");
        }
        if (scriptText.strip().length() < MIN_SCRIPT_LENGTH) {
            throw new ValidationException("rescore",
                "script_text must be at least " + MIN_SCRIPT_LENGTH + " characters");
        }
        if (baselineScore != null && !Double.isFinite(baselineScore)) {
            throw new ValidationException("rescore", "baseline_score must be a finite number");
        }

        Evaluation evaluation = evaluator.evaluate(scriptText, constraints, context, baselineScore);
        List<DetectorResult> rankings = evaluation.detectorRankings();

        return new RescoreResult(
            evaluation.scoreBreakdown(),
            rankings,
            NextActionPlanner.plan(rankings, evaluator.suite().registry()),
            LineEditPlanner.plan(evaluation.script(), constraints, rankings, evaluator.suite().registry()),
            improvementDiff(baselineScore, baselineDetectorRankings, evaluation),
            constraints.formatType(),
            constraints.durationSeconds(),
            ScriptFingerprint.of(scriptText));
    }

    static ImprovementDiff improvementDiff(Double baselineScore,
                                           List<DetectorResult> baselineRankings,
                                           Evaluation evaluation) {
        Map<String, Double> before = new HashMap<>();
        if (baselineRankings != null) {
            for (DetectorResult result : baselineRankings) {
                if (result != null && result.detectorKey() != null && Double.isFinite(result.score())) {
                    before.put(result.detectorKey(), result.score());
                }
            }
        }

        List<DetectorDelta> detectors = new ArrayList<>();
        for (DetectorResult result : evaluation.detectorRankings()) {
            Double previous = before.get(result.detectorKey());
            Double delta = previous == null ? null : Scores.round1(result.score() - previous);
            detectors.add(new DetectorDelta(result.detectorKey(), previous, result.score(), delta));
        }

        double after = evaluation.combined();
        Double combinedBefore = baselineScore == null ? null : Scores.round1(baselineScore);
        Double combinedDelta = baselineScore == null ? null : Scores.round1(after - baselineScore);
        return new ImprovementDiff(combinedBefore, after, combinedDelta, detectors);
    }
}
