package com.scriptplatform.common.model;

/**
 * Measured post-publication performance. All values must be finite and non-negative.
 */
public record ActualMetrics(
    long views,
    long likes,
    long comments,
    long shares,
    long saves,
    double avgViewDurationS
) {}
