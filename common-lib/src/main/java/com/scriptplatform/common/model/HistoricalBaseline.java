package com.scriptplatform.common.model;

/**
 * The user's own measured track record for one platform, read from the 30-day drift window.
 *
 * @param sampleCount     outcomes in the window
 * @param meanDelta       mean (actual − predicted) across those outcomes
 * @param meanActualScore mean actual score across those outcomes
 */
public record HistoricalBaseline(
    int sampleCount,
    double meanDelta,
    double meanActualScore
) {
    public static HistoricalBaseline empty() {
        return new HistoricalBaseline(0, 0.0, 0.0);
    }

    public static HistoricalBaseline fromWindow(DriftWindow window) {
        if (window == null || window.count() == 0) {
            return empty();
        }
        return new HistoricalBaseline(window.count(), window.meanDelta(), window.meanActualScore());
    }
}
