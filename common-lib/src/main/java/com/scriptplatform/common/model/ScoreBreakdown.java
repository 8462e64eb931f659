package com.scriptplatform.common.model;

import java.util.Map;

/**
 * Immutable output of the signal combiner.
 *
 * <p>{@code weights} is a copy of the weights in force when this breakdown was computed,
 * so a stored breakdown can always be re-derived even after the policy table changes.
 * {@code deltaFromBaseline} is {@code null} when no baseline was supplied; a zero delta
 * means the baseline was supplied and matched.
 */
public record ScoreBreakdown(
    double platformMetrics,
    double competitorMetrics,
    double historicalMetrics,
    double combined,
    Confidence confidence,
    Map<String, Double> weights,
    Map<String, Integer> sampleCounts,
    Double deltaFromBaseline
) {
    /** One rounding unit of {@code combined}. */
    public static final double ROUNDING_UNIT = 0.1;

    public ScoreBreakdown {
        weights = weights == null ? Map.of() : Map.copyOf(weights);
        sampleCounts = sampleCounts == null ? Map.of() : Map.copyOf(sampleCounts);
    }

    /**
     * Re-applies the recorded weights to the three recorded channel scores.
     * Audit check: the result must equal {@code combined} within {@link #ROUNDING_UNIT}.
     */
    public double recomputeCombined() {
        return weights.getOrDefault(Channel.PLATFORM.key(), 0.0)   * platformMetrics
             + weights.getOrDefault(Channel.COMPETITOR.key(), 0.0) * competitorMetrics
             + weights.getOrDefault(Channel.HISTORICAL.key(), 0.0) * historicalMetrics;
    }

    public ScoreBreakdown withBaseline(Double baselineScore) {
        Double delta = baselineScore == null ? null : Scores.round1(combined - baselineScore);
        return new ScoreBreakdown(platformMetrics, competitorMetrics, historicalMetrics, combined,
                                  confidence, weights, sampleCounts, delta);
    }
}
