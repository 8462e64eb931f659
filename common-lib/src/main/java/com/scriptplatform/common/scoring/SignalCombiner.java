package com.scriptplatform.common.scoring;

import com.scriptplatform.common.model.Channel;
import com.scriptplatform.common.model.ScoreBreakdown;
import com.scriptplatform.common.model.Scores;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combines the three channel scores into one {@link ScoreBreakdown}.
 *
 * <p>A channel with zero samples is scored at {@link Scores#NEUTRAL} rather than its raw
 * value. Channel scores are rounded before weighting, so re-applying the recorded weights
 * to the recorded sub-scores reproduces {@code combined} within one rounding unit.
 *
 * <p>Stateless and thread-safe.
 */
public final class SignalCombiner {

    private final ConfidencePolicy confidencePolicy;

    public SignalCombiner(ConfidencePolicy confidencePolicy) {
        this.confidencePolicy = confidencePolicy;
    }

    public SignalCombiner() {
        this(ConfidencePolicy.DEFAULT);
    }

    /**
     * @param sampleCounts  channel key to sample count
     * @param weights       weights in force for this request; copied into the result
     * @param baselineScore prior combined score, or {@code null} when none was supplied
     */
    public ScoreBreakdown combine(double platformMetrics,
                                  double competitorMetrics,
                                  double historicalMetrics,
                                  Map<String, Integer> sampleCounts,
                                  ChannelWeights weights,
                                  Double baselineScore) {
        double platform = channelScore(platformMetrics, sampleCounts, Channel.PLATFORM);
        double competitor = channelScore(competitorMetrics, sampleCounts, Channel.COMPETITOR);
        double historical = channelScore(historicalMetrics, sampleCounts, Channel.HISTORICAL);

        double combined = Scores.round1(Scores.clamp(
            weights.platform() * platform
                + weights.competitor() * competitor
                + weights.historical() * historical));

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Channel channel : Channel.values()) {
            counts.put(channel.key(), ConfidencePolicy.count(sampleCounts, channel));
        }

        ScoreBreakdown breakdown = new ScoreBreakdown(platform, competitor, historical, combined,
            confidencePolicy.classify(counts), weights.asMap(), counts, null);
        return breakdown.withBaseline(baselineScore);
    }

    private static double channelScore(double raw, Map<String, Integer> sampleCounts, Channel channel) {
        if (ConfidencePolicy.count(sampleCounts, channel) == 0 || !Double.isFinite(raw)) {
            return Scores.NEUTRAL;
        }
        return Scores.round1(Scores.clamp(raw));
    }
}
