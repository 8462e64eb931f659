package com.scriptplatform.optimizer.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.scriptplatform.common.model.CompetitorBenchmark;
import com.scriptplatform.common.model.ScriptConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Fetches the competitor benchmark for a platform/format from the channel-data collaborator.
 * Unconfigured or failing collaborators yield {@link CompetitorBenchmark#empty()}.
 */
@Component
public class CompetitorBenchmarkClient {

    private static final Logger log = LoggerFactory.getLogger(CompetitorBenchmarkClient.class);

    private final WebClient competitorClient;
    private final boolean configured;

    public CompetitorBenchmarkClient(@Qualifier("competitorClient") WebClient competitorClient,
                                     @Value("${services.competitor.base-url:}") String baseUrl) {
        this.competitorClient = competitorClient;
        this.configured = baseUrl != null && !baseUrl.isBlank();
    }

    public Mono<CompetitorBenchmark> fetchBenchmark(String userId, ScriptConstraints constraints) {
        if (!configured || userId == null || userId.isBlank() || !constraints.platform().known()) {
            return Mono.just(CompetitorBenchmark.empty());
        }
        return competitorClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/competitors/benchmark")
                .queryParam("platform", constraints.platform().key())
                .queryParam("format", constraints.formatType().key())
                .build())
            .header(UserHeaders.USER_ID, userId)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(CompetitorBenchmarkClient::toBenchmark)
            .defaultIfEmpty(CompetitorBenchmark.empty())
            .onErrorResume(e -> {
                log.warn("Benchmark fetch failed, using empty benchmark. platform={} reason={}",
                         constraints.platform().key(), e.getMessage());
                return Mono.just(CompetitorBenchmark.empty());
            });
    }

    static CompetitorBenchmark toBenchmark(JsonNode node) {
        return new CompetitorBenchmark(
            Math.max(0, node.path("sample_size").asInt(0)),
            Math.max(0, node.path("competitor_count").asInt(0)),
            node.path("difficulty_score").asDouble(CompetitorBenchmark.DEFAULT_DIFFICULTY));
    }
}
