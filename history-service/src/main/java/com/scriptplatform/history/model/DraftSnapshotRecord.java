package com.scriptplatform.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted draft snapshot. Rows are only ever inserted.
 *
 * <p>{@code id} is a database identity, so ordering by id is ordering by creation.
 * The rescore output is stored as JSON columns, each a snapshot of what the user saw
 * at save time:
 *   detectorRankings → List&lt;DetectorResult&gt;
 *   nextActions      → List&lt;NextAction&gt;
 *   lineLevelEdits   → List&lt;LineLevelEdit&gt;
 *   scoreBreakdown   → ScoreBreakdown (weights included)
 */
@Data
@NoArgsConstructor
@Table("draft_snapshots")
public class DraftSnapshotRecord {

    @Id
    private Long id;

    private String userId;

    private String platform;

    private String sourceItemId;

    private String variantId;

    private String scriptText;

    private Double baselineScore;

    private double rescoredScore;

    private Double deltaScore;

    private String detectorRankings;

    private String nextActions;

    private String lineLevelEdits;

    private String scoreBreakdown;

    private LocalDateTime createdAt;
}
