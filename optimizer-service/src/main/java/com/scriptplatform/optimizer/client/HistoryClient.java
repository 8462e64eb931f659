package com.scriptplatform.optimizer.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.scriptplatform.common.model.HistoricalBaseline;
import com.scriptplatform.common.model.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Reads the user's 30-day drift window from history-service to feed the historical channel.
 *
 * <p>All errors are absorbed with an empty baseline: the channel then scores neutral and
 * confidence drops to {@code low}, which is the cold-start behaviour anyway.
 */
@Component
public class HistoryClient {

    private static final Logger log = LoggerFactory.getLogger(HistoryClient.class);

    private final WebClient historyClient;

    public HistoryClient(@Qualifier("historyClient") WebClient historyClient) {
        this.historyClient = historyClient;
    }

    public Mono<HistoricalBaseline> fetchBaseline(String userId, Platform platform) {
        if (userId == null || userId.isBlank() || !platform.known()) {
            return Mono.just(HistoricalBaseline.empty());
        }
        return historyClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/calibration/summary")
                .queryParam("platform", platform.key())
                .build())
            .header(UserHeaders.USER_ID, userId)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(HistoryClient::toBaseline)
            .defaultIfEmpty(HistoricalBaseline.empty())
            .onErrorResume(e -> {
                log.warn("Calibration fetch failed, using empty baseline. platform={} reason={}",
                         platform.key(), e.getMessage());
                return Mono.just(HistoricalBaseline.empty());
            });
    }

    static HistoricalBaseline toBaseline(JsonNode summary) {
        JsonNode d30 = summary.path("drift_windows").path("d30");
        int count = d30.path("count").asInt(0);
        if (count <= 0) {
            return HistoricalBaseline.empty();
        }
        return new HistoricalBaseline(count,
                                      d30.path("mean_delta").asDouble(0.0),
                                      d30.path("mean_actual_score").asDouble(0.0));
    }
}
