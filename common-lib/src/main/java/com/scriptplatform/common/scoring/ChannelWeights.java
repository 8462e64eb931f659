package com.scriptplatform.common.scoring;

import com.scriptplatform.common.model.Channel;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the weight policy. The three weights must sum to 1.0.
 */
public record ChannelWeights(
    double platform,
    double competitor,
    double historical
) {
    private static final double TOLERANCE = 1e-6;

    public ChannelWeights {
        if (platform < 0 || competitor < 0 || historical < 0) {
            throw new IllegalArgumentException("channel weights must be >= 0");
        }
        double sum = platform + competitor + historical;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("channel weights must sum to 1.0, got " + sum);
        }
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(Channel.PLATFORM.key(), platform);
        map.put(Channel.COMPETITOR.key(), competitor);
        map.put(Channel.HISTORICAL.key(), historical);
        return map;
    }
}
