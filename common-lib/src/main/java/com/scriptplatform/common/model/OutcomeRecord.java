package com.scriptplatform.common.model;

import java.time.Instant;
import java.util.List;

/**
 * Historical ground truth for a published snapshot. Never mutated; several records per
 * snapshot are expected (one per measurement).
 *
 * @param predictedScore   copied from the snapshot (or the caller) at ingestion time
 * @param actualScore      computed from {@code actualMetrics} on the historical-channel scale
 * @param calibrationDelta {@code actualScore − predictedScore}
 */
public record OutcomeRecord(
    Long id,
    Long draftSnapshotId,
    Platform platform,
    String measurementLabel,
    Instant postedAt,
    ActualMetrics actualMetrics,
    List<RetentionPoint> retentionPoints,
    double predictedScore,
    double actualScore,
    double calibrationDelta,
    Instant createdAt
) {
    public OutcomeRecord {
        retentionPoints = retentionPoints == null ? List.of() : List.copyOf(retentionPoints);
    }
}
