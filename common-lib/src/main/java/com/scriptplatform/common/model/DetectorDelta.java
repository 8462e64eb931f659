package com.scriptplatform.common.model;

/**
 * Per-detector movement between a baseline and a rescore. {@code beforeScore} and
 * {@code delta} are null when the baseline did not include this detector.
 */
public record DetectorDelta(
    String detectorKey,
    Double beforeScore,
    double afterScore,
    Double delta
) {}
