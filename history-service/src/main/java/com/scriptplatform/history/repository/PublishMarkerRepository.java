package com.scriptplatform.history.repository;

import com.scriptplatform.history.model.PublishMarkerRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface PublishMarkerRepository extends ReactiveCrudRepository<PublishMarkerRecord, Long> {

    @Query("""
        SELECT * FROM publish_markers
        WHERE user_id = :userId
          AND platform = :platform
        ORDER BY id DESC
        LIMIT 1
        """)
    Mono<PublishMarkerRecord> findLatest(String userId, String platform);
}
