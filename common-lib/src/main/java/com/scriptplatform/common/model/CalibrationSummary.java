package com.scriptplatform.common.model;

import java.util.List;
import java.util.Map;

/**
 * Read-time calibration view for one (user, platform) scope.
 *
 * @param driftWindows     {@code d7} and {@code d30} windows
 * @param sampleSize       all outcomes considered, regardless of window
 * @param hitRate          share of outcomes whose |delta| is within the hit tolerance
 * @param insufficientData true while fewer than five outcomes exist
 * @param recentOutcomes   newest outcomes first, for display
 */
public record CalibrationSummary(
    Platform platform,
    Confidence confidence,
    Trend trend,
    Map<String, DriftWindow> driftWindows,
    int sampleSize,
    double hitRate,
    boolean insufficientData,
    List<String> nextActions,
    List<OutcomeRecord> recentOutcomes
) {
    public static final String WINDOW_7D = "d7";
    public static final String WINDOW_30D = "d30";

    public CalibrationSummary {
        driftWindows = driftWindows == null ? Map.of() : Map.copyOf(driftWindows);
        nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
        recentOutcomes = recentOutcomes == null ? List.of() : List.copyOf(recentOutcomes);
    }

    public DriftWindow d7() {
        return driftWindows.getOrDefault(WINDOW_7D, DriftWindow.empty(7));
    }

    public DriftWindow d30() {
        return driftWindows.getOrDefault(WINDOW_30D, DriftWindow.empty(30));
    }
}
