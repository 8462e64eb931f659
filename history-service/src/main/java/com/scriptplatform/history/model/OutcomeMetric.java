package com.scriptplatform.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One measured outcome for a snapshot. Never updated; a snapshot collects one row per
 * measurement ("now", "7d", "30d", ...).
 */
@Data
@NoArgsConstructor
@Table("outcome_metrics")
public class OutcomeMetric {

    @Id
    private Long id;

    private String userId;
    private String platform;
    private Long   draftSnapshotId;
    private String measurementLabel;

    private LocalDateTime postedAt;

    private long   views;
    private long   likes;
    private long   comments;
    private long   shares;
    private long   saves;
    private double avgViewDurationS;

    /** JSON-serialised {@code List<RetentionPoint>}, null when no curve was supplied */
    private String retentionPoints;

    private double predictedScore;
    private double actualScore;
    private double calibrationDelta;

    private LocalDateTime createdAt;
}
