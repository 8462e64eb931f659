package com.scriptplatform.common.model;

/**
 * Competitor baseline for one platform/format, supplied by the channel-data collaborator.
 *
 * @param sampleSize      number of competitor videos behind the benchmark
 * @param competitorCount number of tracked channels
 * @param difficultyScore 0–100, how hard the niche is to compete in (55 when unknown)
 */
public record CompetitorBenchmark(
    int sampleSize,
    int competitorCount,
    double difficultyScore
) {
    public static final double DEFAULT_DIFFICULTY = 55.0;

    public static CompetitorBenchmark empty() {
        return new CompetitorBenchmark(0, 0, DEFAULT_DIFFICULTY);
    }
}
