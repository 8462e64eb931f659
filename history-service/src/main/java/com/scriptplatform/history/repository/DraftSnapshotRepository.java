package com.scriptplatform.history.repository;

import com.scriptplatform.history.model.DraftSnapshotRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface DraftSnapshotRepository extends ReactiveCrudRepository<DraftSnapshotRecord, Long> {

    Mono<DraftSnapshotRecord> findByIdAndUserId(Long id, String userId);

    @Query("""
        SELECT * FROM draft_snapshots
        WHERE user_id = :userId
          AND platform = :platform
        ORDER BY id DESC
        LIMIT :limit
        """)
    Flux<DraftSnapshotRecord> findRecent(String userId, String platform, int limit);
}
