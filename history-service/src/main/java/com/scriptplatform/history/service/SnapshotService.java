package com.scriptplatform.history.service;

import com.scriptplatform.common.exception.PreconditionFailedException;
import com.scriptplatform.common.exception.ResourceNotFoundException;
import com.scriptplatform.common.exception.ScoringException;
import com.scriptplatform.common.exception.StoreUnavailableException;
import com.scriptplatform.common.exception.ValidationException;
import com.scriptplatform.common.model.DraftSnapshot;
import com.scriptplatform.common.model.Platform;
import com.scriptplatform.common.model.PublishMarker;
import com.scriptplatform.common.model.RescoreResult;
import com.scriptplatform.common.model.Scores;
import com.scriptplatform.common.model.SnapshotInput;
import com.scriptplatform.common.scoring.ScriptFingerprint;
import com.scriptplatform.history.model.DraftSnapshotRecord;
import com.scriptplatform.history.model.PublishMarkerRecord;
import com.scriptplatform.history.repository.DraftSnapshotRepository;
import com.scriptplatform.history.repository.PublishMarkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Append-only store of draft snapshots, scoped by (user, platform).
 *
 * <p>A save is accepted only with the rescore output of exactly the submitted text:
 * the result's fingerprint must match and its breakdown must carry a combined score.
 * Anything else is rejected before any row is written.
 */
@Service
public class SnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final DraftSnapshotRepository repository;
    private final PublishMarkerRepository markerRepository;
    private final RecordMapper mapper;
    private final Clock clock;

    public SnapshotService(DraftSnapshotRepository repository,
                           PublishMarkerRepository markerRepository,
                           RecordMapper mapper,
                           Clock clock) {
        this.repository       = repository;
        this.markerRepository = markerRepository;
        this.mapper           = mapper;
        this.clock            = clock;
    }

    public Mono<DraftSnapshot> save(String userId, SnapshotInput input) {
        return Mono.fromCallable(() -> toEntity(userId, input))
            .flatMap(entity -> repository.save(entity)
                .onErrorMap(e -> new StoreUnavailableException("save_snapshot", "snapshot store unavailable", e)))
            .map(mapper::toSnapshot)
            .doOnSuccess(s -> log.info("Snapshot saved. id={} platform={} rescored={} delta={}",
                                       s.id(), s.platform().key(), s.rescoredScore(), s.deltaScore()))
            .doOnError(e -> !(e instanceof ValidationException || e instanceof PreconditionFailedException),
                       e -> log.error("Failed to save snapshot. userId={}", userId, e));
    }

    public Flux<DraftSnapshot> list(String userId, String platform, Integer limit) {
        return Mono.fromCallable(() -> storePlatform("list_snapshots", platform))
            .flatMapMany(p -> repository.findRecent(userId, p.key(), clampLimit(limit)))
            .map(mapper::toSnapshot);
    }

    public Mono<DraftSnapshot> get(String userId, Long id) {
        return repository.findByIdAndUserId(id, userId)
            .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("get_snapshot", "snapshot not found. id=" + id)))
            .map(mapper::toSnapshot);
    }

    public Mono<PublishMarker> markPublished(String userId, Long id) {
        return get(userId, id)
            .flatMap(snapshot -> {
                PublishMarkerRecord marker = new PublishMarkerRecord();
                marker.setUserId(userId);
                marker.setPlatform(snapshot.platform().key());
                marker.setDraftSnapshotId(snapshot.id());
                marker.setMarkedAt(RecordMapper.toUtc(clock.instant()));
                return markerRepository.save(marker)
                    .onErrorMap(e -> !(e instanceof ScoringException),
                                e -> new StoreUnavailableException("mark_published", "snapshot store unavailable", e));
            })
            .map(mapper::toMarker)
            .doOnSuccess(m -> log.info("Snapshot marked published. snapshotId={} platform={}",
                                       m.draftSnapshotId(), m.platform().key()));
    }

    /** Latest publish marker for the platform, empty when nothing was marked yet. */
    public Mono<PublishMarker> published(String userId, String platform) {
        return Mono.fromCallable(() -> storePlatform("published_snapshot", platform))
            .flatMap(p -> markerRepository.findLatest(userId, p.key()))
            .map(mapper::toMarker);
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    static Platform storePlatform(String operation, String value) {
        Platform platform = Platform.resolve(value);
        if (!platform.known()) {
            throw new ValidationException(operation, "unsupported platform: " + value);
        }
        return platform;
    }

    private DraftSnapshotRecord toEntity(String userId, SnapshotInput input) {
        if (input == null) {
            throw new ValidationException("save_snapshot", "snapshot body is required");
        }
        Platform platform = storePlatform("save_snapshot", input.platform());
        if (input.scriptText() == null || input.scriptText().isBlank()) {
            throw new ValidationException("save_snapshot", "script_text is required");
        }
        Double baseline = input.baselineScore();
        if (baseline != null && !Double.isFinite(baseline)) {
            throw new ValidationException("save_snapshot", "baseline_score must be finite");
        }

        RescoreResult rescore = input.rescore();
        if (rescore == null || rescore.scoreBreakdown() == null) {
            throw new PreconditionFailedException("save_snapshot", "draft must be rescored before saving");
        }
        if (!ScriptFingerprint.matches(input.scriptText(), rescore.scriptFingerprint())) {
            throw new PreconditionFailedException("save_snapshot",
                "rescore result does not match the submitted script text; rescore again before saving");
        }

        double rescored = rescore.scoreBreakdown().combined();
        DraftSnapshotRecord entity = new DraftSnapshotRecord();
        entity.setUserId(userId);
        entity.setPlatform(platform.key());
        entity.setSourceItemId(input.sourceItemId());
        entity.setVariantId(input.variantId());
        entity.setScriptText(input.scriptText());
        entity.setBaselineScore(baseline);
        entity.setRescoredScore(rescored);
        entity.setDeltaScore(baseline == null ? null : Scores.round1(rescored - baseline));
        entity.setDetectorRankings(mapper.json(rescore.detectorRankings()));
        entity.setNextActions(mapper.json(rescore.nextActions()));
        entity.setLineLevelEdits(mapper.json(rescore.lineLevelEdits()));
        entity.setScoreBreakdown(mapper.json(rescore.scoreBreakdown()));
        entity.setCreatedAt(RecordMapper.toUtc(clock.instant()));
        return entity;
    }
}
