package com.scriptplatform.optimizer.config;

import com.scriptplatform.common.scoring.ChannelWeights;
import com.scriptplatform.common.scoring.ConfidencePolicy;
import com.scriptplatform.common.scoring.WeightPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Scoring tunables bound from {@code scoring.*}.
 *
 * <p>Weight rows are keyed by {@code platform} or {@code platform.format}; rows given here
 * override the built-in table. Each row must sum to 1.0 or startup fails.
 */
@Data
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    private Weights defaultWeights = new Weights(0.35, 0.45, 0.20);

    private Map<String, Weights> weights = new HashMap<>();

    private Confidence confidence = new Confidence();

    /** Per-detector action thresholds keyed by detector key. */
    private Map<String, Double> actionThresholds = new HashMap<>();

    @Data
    public static class Weights {
        private double platform;
        private double competitor;
        private double historical;

        public Weights() {}

        public Weights(double platform, double competitor, double historical) {
            this.platform = platform;
            this.competitor = competitor;
            this.historical = historical;
        }

        ChannelWeights toChannelWeights() {
            return new ChannelWeights(platform, competitor, historical);
        }
    }

    @Data
    public static class Confidence {
        private int platformHigh = 5;
        private int competitorHigh = 20;
        private int historicalHigh = 10;
    }

    public WeightPolicy toWeightPolicy() {
        Map<String, ChannelWeights> overrides = new HashMap<>();
        weights.forEach((key, row) -> overrides.put(key, row.toChannelWeights()));
        return WeightPolicy.of(defaultWeights.toChannelWeights(), overrides);
    }

    public ConfidencePolicy toConfidencePolicy() {
        return new ConfidencePolicy(confidence.getPlatformHigh(), confidence.getCompetitorHigh(),
                                    confidence.getHistoricalHigh());
    }
}
