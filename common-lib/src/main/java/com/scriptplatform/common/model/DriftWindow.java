package com.scriptplatform.common.model;

/**
 * Calibration error aggregated over outcomes posted within the last {@code days} days.
 * Derived on read, never stored.
 */
public record DriftWindow(
    int days,
    int count,
    double meanDelta,
    double meanAbsError,
    double meanActualScore,
    Bias bias
) {
    public static DriftWindow empty(int days) {
        return new DriftWindow(days, 0, 0.0, 0.0, 0.0, Bias.NEUTRAL);
    }
}
