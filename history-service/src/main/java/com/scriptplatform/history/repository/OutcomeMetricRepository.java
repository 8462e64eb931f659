package com.scriptplatform.history.repository;

import com.scriptplatform.history.model.OutcomeMetric;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface OutcomeMetricRepository extends ReactiveCrudRepository<OutcomeMetric, Long> {

    @Query("""
        SELECT * FROM outcome_metrics
        WHERE user_id = :userId
          AND platform = :platform
        ORDER BY posted_at DESC, id DESC
        """)
    Flux<OutcomeMetric> findByScope(String userId, String platform);
}
