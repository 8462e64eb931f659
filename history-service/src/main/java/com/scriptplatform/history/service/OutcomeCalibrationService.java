package com.scriptplatform.history.service;

import com.scriptplatform.common.calibration.CalibrationCalculator;
import com.scriptplatform.common.calibration.CalibrationThresholds;
import com.scriptplatform.common.exception.PreconditionFailedException;
import com.scriptplatform.common.exception.ResourceNotFoundException;
import com.scriptplatform.common.exception.ScoringException;
import com.scriptplatform.common.exception.StoreUnavailableException;
import com.scriptplatform.common.exception.ValidationException;
import com.scriptplatform.common.model.ActualMetrics;
import com.scriptplatform.common.model.CalibrationSummary;
import com.scriptplatform.common.model.DraftSnapshot;
import com.scriptplatform.common.model.OutcomeInput;
import com.scriptplatform.common.model.OutcomeRecord;
import com.scriptplatform.common.model.Platform;
import com.scriptplatform.common.model.RetentionPoint;
import com.scriptplatform.common.model.Scores;
import com.scriptplatform.common.scoring.HistoricalChannelScorer;
import com.scriptplatform.history.model.OutcomeMetric;
import com.scriptplatform.history.repository.OutcomeMetricRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Ingests measured outcomes and summarises calibration drift.
 *
 * <p>Ingestion is deliberately not idempotent: each call appends one record, so a
 * snapshot can collect "now", "7d" and "30d" measurements. Summaries are computed on
 * read from every outcome in the (user, platform) scope.
 */
@Service
public class OutcomeCalibrationService {

    private static final Logger log = LoggerFactory.getLogger(OutcomeCalibrationService.class);

    static final String DEFAULT_MEASUREMENT = "now";

    private final OutcomeMetricRepository repository;
    private final SnapshotService snapshotService;
    private final RecordMapper mapper;
    private final CalibrationThresholds thresholds;
    private final Clock clock;

    public OutcomeCalibrationService(OutcomeMetricRepository repository,
                                     SnapshotService snapshotService,
                                     RecordMapper mapper,
                                     CalibrationThresholds thresholds,
                                     Clock clock) {
        this.repository      = repository;
        this.snapshotService = snapshotService;
        this.mapper          = mapper;
        this.thresholds      = thresholds;
        this.clock           = clock;
    }

    public Mono<OutcomeRecord> ingest(String userId, OutcomeInput input) {
        return Mono.fromRunnable(() -> validate(input))
            .then(Mono.defer(() -> resolveSnapshot(userId, input)))
            .onErrorMap(e -> !(e instanceof ScoringException),
                        e -> new StoreUnavailableException("ingest_outcome", "snapshot store unavailable", e))
            .map(snapshot -> toEntity(userId, input, snapshot))
            .flatMap(entity -> repository.save(entity)
                .onErrorMap(e -> new StoreUnavailableException("ingest_outcome", "outcome store unavailable", e)))
            .map(mapper::toOutcome)
            .doOnSuccess(o -> log.info("Outcome ingested. id={} snapshotId={} label={} predicted={} actual={} delta={}",
                o.id(), o.draftSnapshotId(), o.measurementLabel(), o.predictedScore(),
                o.actualScore(), o.calibrationDelta()));
    }

    public Mono<CalibrationSummary> summarize(String userId, String platformKey) {
        return Mono.fromCallable(() -> SnapshotService.storePlatform("calibration_summary", platformKey))
            .flatMap(platform -> repository.findByScope(userId, platform.key())
                .map(mapper::toOutcome)
                .collectList()
                .map(outcomes -> CalibrationCalculator.summarize(platform, outcomes, clock.instant(), thresholds)))
            .doOnSuccess(s -> log.info("Calibration summarised. platform={} samples={} confidence={} trend={}",
                s.platform().key(), s.sampleSize(), s.confidence().key(), s.trend().key()));
    }

    /**
     * Explicit id wins; otherwise the latest publish marker for the platform names the
     * target snapshot. A snapshot that does not exist is a failed precondition of the
     * ingest, not a missing resource of this request.
     */
    private Mono<DraftSnapshot> resolveSnapshot(String userId, OutcomeInput input) {
        if (input.draftSnapshotId() != null) {
            return snapshotService.get(userId, input.draftSnapshotId())
                .onErrorMap(ResourceNotFoundException.class, e -> new PreconditionFailedException("ingest_outcome",
                    "draft_snapshot_id does not exist. id=" + input.draftSnapshotId()));
        }
        return snapshotService.published(userId, input.platform())
            .switchIfEmpty(Mono.error(() -> new ValidationException("ingest_outcome",
                "draft_snapshot_id is required when no snapshot was marked published for the platform")))
            .flatMap(marker -> snapshotService.get(userId, marker.draftSnapshotId()));
    }

    private OutcomeMetric toEntity(String userId, OutcomeInput input, DraftSnapshot snapshot) {
        Platform platform = snapshot.platform();
        if (input.platform() != null && !input.platform().isBlank()
                && SnapshotService.storePlatform("ingest_outcome", input.platform()) != platform) {
            throw new ValidationException("ingest_outcome", "platform " + input.platform()
                + " does not match the snapshot platform " + platform.key());
        }
        List<RetentionPoint> retention = input.retentionPoints() == null ? List.of() : input.retentionPoints();

        double predicted = input.predictedScore() != null ? input.predictedScore() : snapshot.rescoredScore();
        double actual = HistoricalChannelScorer.actualScore(input.actualMetrics(), retention);
        Instant postedAt = input.postedAt() != null ? input.postedAt() : clock.instant();

        ActualMetrics metrics = input.actualMetrics();
        OutcomeMetric entity = new OutcomeMetric();
        entity.setUserId(userId);
        entity.setPlatform(platform.key());
        entity.setDraftSnapshotId(snapshot.id());
        entity.setMeasurementLabel(input.measurementLabel() == null || input.measurementLabel().isBlank()
            ? DEFAULT_MEASUREMENT : input.measurementLabel().trim());
        entity.setPostedAt(RecordMapper.toUtc(postedAt));
        entity.setViews(metrics.views());
        entity.setLikes(metrics.likes());
        entity.setComments(metrics.comments());
        entity.setShares(metrics.shares());
        entity.setSaves(metrics.saves());
        entity.setAvgViewDurationS(metrics.avgViewDurationS());
        entity.setRetentionPoints(retention.isEmpty() ? null : mapper.json(retention));
        entity.setPredictedScore(predicted);
        entity.setActualScore(actual);
        entity.setCalibrationDelta(Scores.round1(actual - predicted));
        entity.setCreatedAt(RecordMapper.toUtc(clock.instant()));
        return entity;
    }

    static void validate(OutcomeInput input) {
        if (input == null) {
            throw new ValidationException("ingest_outcome", "outcome body is required");
        }
        ActualMetrics m = input.actualMetrics();
        if (m == null) {
            throw new ValidationException("ingest_outcome", "actual_metrics is required");
        }
        if (m.views() < 0 || m.likes() < 0 || m.comments() < 0 || m.shares() < 0 || m.saves() < 0) {
            throw new ValidationException("ingest_outcome", "actual_metrics counts must be >= 0");
        }
        if (!Double.isFinite(m.avgViewDurationS()) || m.avgViewDurationS() < 0) {
            throw new ValidationException("ingest_outcome", "avg_view_duration_s must be finite and >= 0");
        }
        if (input.retentionPoints() != null) {
            for (RetentionPoint p : input.retentionPoints()) {
                if (p == null || !Double.isFinite(p.time()) || !Double.isFinite(p.retention())
                        || p.time() < 0 || p.retention() < 0) {
                    throw new ValidationException("ingest_outcome", "retention points must be finite and >= 0");
                }
            }
        }
        Double predicted = input.predictedScore();
        if (predicted != null && (!Double.isFinite(predicted) || predicted < Scores.MIN || predicted > Scores.MAX)) {
            throw new ValidationException("ingest_outcome", "predicted_score must be within [0, 100]");
        }
        if (input.draftSnapshotId() == null) {
            // marker lookup needs a concrete platform
            SnapshotService.storePlatform("ingest_outcome", input.platform());
        }
    }
}
