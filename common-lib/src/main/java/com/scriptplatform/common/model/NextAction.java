package com.scriptplatform.common.model;

/**
 * Recommendation emitted for a detector scoring below its action threshold.
 *
 * @param thresholdGap how far below the threshold the detector landed (ranking key)
 * @param priority     detector priority, lower is more important (tie-break)
 */
public record NextAction(
    String detectorKey,
    String title,
    String why,
    double thresholdGap,
    int priority
) {}
