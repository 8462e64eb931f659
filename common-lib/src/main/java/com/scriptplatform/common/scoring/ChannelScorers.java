package com.scriptplatform.common.scoring;

import com.scriptplatform.common.detector.DetectorDefinition;
import com.scriptplatform.common.detector.DetectorRegistry;
import com.scriptplatform.common.model.CompetitorBenchmark;
import com.scriptplatform.common.model.DetectorResult;
import com.scriptplatform.common.model.HistoricalBaseline;
import com.scriptplatform.common.model.Scores;

import java.util.List;

/**
 * Raw channel scores before combination. No logging, no side effects.
 */
public final class ChannelScorers {

    /** Benchmark difficulty at which the competitor channel equals the platform channel. */
    static final double COMPETITOR_PIVOT = 70.0;
    static final double HISTORICAL_ADJUSTED_WEIGHT = 0.6;
    static final double HISTORICAL_ACTUAL_WEIGHT = 0.4;

    private ChannelScorers() {}

    /** Detector-weighted mean of the detector scores. */
    public static double platform(List<DetectorResult> results, DetectorRegistry registry) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (DetectorResult result : results) {
            double weight = registry.find(result.detectorKey())
                .map(DetectorDefinition::weight)
                .orElse(0.0);
            weighted += weight * result.score();
            totalWeight += weight;
        }
        if (totalWeight <= 0.0) {
            return results.isEmpty()
                ? Scores.NEUTRAL
                : results.stream().mapToDouble(DetectorResult::score).average().orElse(Scores.NEUTRAL);
        }
        return Scores.round1(weighted / totalWeight);
    }

    /** Detectors that ran without failing. */
    public static int platformSamples(List<DetectorResult> results) {
        return (int) results.stream().filter(r -> !r.failed()).count();
    }

    public static double competitor(double platformScore, CompetitorBenchmark benchmark) {
        return Scores.clamp(platformScore + (COMPETITOR_PIVOT - benchmark.difficultyScore()));
    }

    public static double historical(double platformScore, HistoricalBaseline baseline) {
        return Scores.clamp(HISTORICAL_ADJUSTED_WEIGHT * (platformScore + baseline.meanDelta())
                          + HISTORICAL_ACTUAL_WEIGHT * baseline.meanActualScore());
    }
}
