package com.scriptplatform.common.calibration;

/**
 * Tunable constants of the calibration loop.
 *
 * @param biasTolerance       |mean delta| above this classifies a window as biased
 * @param highConfidenceCount d30 outcomes needed for {@code high} confidence
 * @param trendMargin         MAE difference between d7 and d30 that counts as a trend
 * @param hitTolerance        |delta| within this counts as a hit
 * @param recentLimit         outcomes returned for display
 * @param minimumSamples      below this the summary is flagged as insufficient
 */
public record CalibrationThresholds(
    double biasTolerance,
    int highConfidenceCount,
    double trendMargin,
    double hitTolerance,
    int recentLimit,
    int minimumSamples
) {
    public static final CalibrationThresholds DEFAULT = new CalibrationThresholds(3.0, 20, 1.5, 10.0, 12, 5);

    public CalibrationThresholds {
        if (biasTolerance < 0 || trendMargin < 0 || hitTolerance < 0) {
            throw new IllegalArgumentException("calibration tolerances must be >= 0");
        }
        if (highConfidenceCount < 1 || recentLimit < 1) {
            throw new IllegalArgumentException("highConfidenceCount and recentLimit must be >= 1");
        }
    }
}
