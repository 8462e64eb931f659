package com.scriptplatform.optimizer.service;

import com.scriptplatform.common.model.ChannelContext;
import com.scriptplatform.common.model.ScriptConstraints;
import com.scriptplatform.optimizer.client.CompetitorBenchmarkClient;
import com.scriptplatform.optimizer.client.HistoryClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class RemoteChannelContextProvider implements ChannelContextProvider {

    private final CompetitorBenchmarkClient competitorClient;
    private final HistoryClient historyClient;

    public RemoteChannelContextProvider(CompetitorBenchmarkClient competitorClient, HistoryClient historyClient) {
        this.competitorClient = competitorClient;
        this.historyClient = historyClient;
    }

    @Override
    public Mono<ChannelContext> contextFor(String userId, ScriptConstraints constraints) {
        return Mono.zip(
                competitorClient.fetchBenchmark(userId, constraints),
                historyClient.fetchBaseline(userId, constraints.platform()))
            .map(tuple -> new ChannelContext(tuple.getT1(), tuple.getT2()));
    }
}
