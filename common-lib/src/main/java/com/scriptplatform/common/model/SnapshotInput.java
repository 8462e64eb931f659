package com.scriptplatform.common.model;

/**
 * Save request for a draft snapshot. {@code rescore} must be the rescore output for
 * exactly {@code scriptText}; the store rejects the save otherwise.
 */
public record SnapshotInput(
    String platform,
    String sourceItemId,
    String variantId,
    String scriptText,
    Double baselineScore,
    RescoreResult rescore
) {}
