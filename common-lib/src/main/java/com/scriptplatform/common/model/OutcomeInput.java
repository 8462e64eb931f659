package com.scriptplatform.common.model;

import java.time.Instant;
import java.util.List;

/**
 * Ingestion request for a measured outcome.
 *
 * @param draftSnapshotId  target snapshot; when null, the latest publish marker for
 *                         {@code platform} is used
 * @param predictedScore   explicit prediction; when null it is copied from the snapshot
 * @param measurementLabel free-form label such as {@code now}, {@code 7d}, {@code 30d}
 */
public record OutcomeInput(
    Long draftSnapshotId,
    String platform,
    ActualMetrics actualMetrics,
    List<RetentionPoint> retentionPoints,
    Instant postedAt,
    Double predictedScore,
    String measurementLabel
) {}
