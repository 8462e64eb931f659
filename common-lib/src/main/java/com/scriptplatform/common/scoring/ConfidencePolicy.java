package com.scriptplatform.common.scoring;

import com.scriptplatform.common.model.Channel;
import com.scriptplatform.common.model.Confidence;

import java.util.Map;

/**
 * Sample-count thresholds at which each channel counts as well supported.
 */
public record ConfidencePolicy(
    int platformHigh,
    int competitorHigh,
    int historicalHigh
) {
    public static final ConfidencePolicy DEFAULT = new ConfidencePolicy(5, 20, 10);

    /**
     * {@code low} if any channel has zero samples, {@code high} if every channel meets
     * its threshold, otherwise {@code medium}.
     */
    public Confidence classify(Map<String, Integer> sampleCounts) {
        int platform = count(sampleCounts, Channel.PLATFORM);
        int competitor = count(sampleCounts, Channel.COMPETITOR);
        int historical = count(sampleCounts, Channel.HISTORICAL);
        if (platform == 0 || competitor == 0 || historical == 0) {
            return Confidence.LOW;
        }
        if (platform >= platformHigh && competitor >= competitorHigh && historical >= historicalHigh) {
            return Confidence.HIGH;
        }
        return Confidence.MEDIUM;
    }

    static int count(Map<String, Integer> sampleCounts, Channel channel) {
        if (sampleCounts == null) {
            return 0;
        }
        Integer value = sampleCounts.get(channel.key());
        return value == null ? 0 : Math.max(0, value);
    }
}
