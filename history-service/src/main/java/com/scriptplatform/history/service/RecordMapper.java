package com.scriptplatform.history.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptplatform.common.model.ActualMetrics;
import com.scriptplatform.common.model.DetectorResult;
import com.scriptplatform.common.model.DraftSnapshot;
import com.scriptplatform.common.model.LineLevelEdit;
import com.scriptplatform.common.model.NextAction;
import com.scriptplatform.common.model.OutcomeRecord;
import com.scriptplatform.common.model.Platform;
import com.scriptplatform.common.model.PublishMarker;
import com.scriptplatform.common.model.RetentionPoint;
import com.scriptplatform.common.model.ScoreBreakdown;
import com.scriptplatform.history.model.DraftSnapshotRecord;
import com.scriptplatform.history.model.OutcomeMetric;
import com.scriptplatform.history.model.PublishMarkerRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Converts between persisted rows and the shared domain records. JSON columns are
 * written and read with the service's snake_case {@link ObjectMapper}; timestamps are
 * stored as UTC {@link LocalDateTime}.
 */
@Component
public class RecordMapper {

    private static final TypeReference<List<DetectorResult>> RANKINGS = new TypeReference<>() {};
    private static final TypeReference<List<NextAction>> ACTIONS = new TypeReference<>() {};
    private static final TypeReference<List<LineLevelEdit>> EDITS = new TypeReference<>() {};
    private static final TypeReference<List<RetentionPoint>> RETENTION = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RecordMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DraftSnapshot toSnapshot(DraftSnapshotRecord row) {
        try {
            return new DraftSnapshot(
                row.getId(),
                Platform.resolve(row.getPlatform()),
                row.getSourceItemId(),
                row.getVariantId(),
                row.getScriptText(),
                row.getBaselineScore(),
                row.getRescoredScore(),
                row.getDeltaScore(),
                objectMapper.readValue(row.getDetectorRankings(), RANKINGS),
                objectMapper.readValue(row.getNextActions(), ACTIONS),
                objectMapper.readValue(row.getLineLevelEdits(), EDITS),
                objectMapper.readValue(row.getScoreBreakdown(), ScoreBreakdown.class),
                toInstant(row.getCreatedAt()));
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable draft snapshot row. id=" + row.getId(), e);
        }
    }

    public OutcomeRecord toOutcome(OutcomeMetric row) {
        List<RetentionPoint> retention;
        try {
            retention = row.getRetentionPoints() == null
                ? List.of()
                : objectMapper.readValue(row.getRetentionPoints(), RETENTION);
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable outcome row. id=" + row.getId(), e);
        }
        return new OutcomeRecord(
            row.getId(),
            row.getDraftSnapshotId(),
            Platform.resolve(row.getPlatform()),
            row.getMeasurementLabel(),
            toInstant(row.getPostedAt()),
            new ActualMetrics(row.getViews(), row.getLikes(), row.getComments(),
                              row.getShares(), row.getSaves(), row.getAvgViewDurationS()),
            retention,
            row.getPredictedScore(),
            row.getActualScore(),
            row.getCalibrationDelta(),
            toInstant(row.getCreatedAt()));
    }

    public PublishMarker toMarker(PublishMarkerRecord row) {
        return new PublishMarker(row.getId(), Platform.resolve(row.getPlatform()),
                                 row.getDraftSnapshotId(), toInstant(row.getMarkedAt()));
    }

    public String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialise column value for persistence", e);
        }
    }

    public static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    public static Instant toInstant(LocalDateTime utc) {
        return utc == null ? null : utc.toInstant(ZoneOffset.UTC);
    }
}
