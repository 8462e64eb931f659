package com.scriptplatform.optimizer.dto;

import com.scriptplatform.common.model.DetectorResult;
import com.scriptplatform.common.model.ScriptConstraints;

import java.util.List;

/**
 * Body of {@code POST /api/v1/optimizer/rescore}.
 *
 * @param baselineScore            combined score of the draft before editing, optional
 * @param baselineDetectorRankings detector results before editing, optional; only
 *                                 {@code detector_key} and {@code score} are read
 */
public record RescoreRequest(
    String scriptText,
    String platform,
    Integer durationSeconds,
    String tone,
    String hookStyle,
    String ctaStyle,
    String pacingDensity,
    Double baselineScore,
    List<DetectorResult> baselineDetectorRankings
) {
    public ScriptConstraints toConstraints() {
        return ScriptConstraints.of(platform, durationSeconds, tone, hookStyle, ctaStyle, pacingDensity);
    }
}
