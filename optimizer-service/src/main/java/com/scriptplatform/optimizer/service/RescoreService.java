package com.scriptplatform.optimizer.service;

import com.scriptplatform.common.model.RescoreResult;
import com.scriptplatform.common.model.ScriptConstraints;
import com.scriptplatform.common.rescore.Rescorer;
import com.scriptplatform.optimizer.dto.RescoreRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
public class RescoreService {

    private static final Logger log = LoggerFactory.getLogger(RescoreService.class);

    private final Rescorer rescorer;
    private final ChannelContextProvider contextProvider;

    public RescoreService(Rescorer rescorer, ChannelContextProvider contextProvider) {
        this.rescorer = rescorer;
        this.contextProvider = contextProvider;
    }

    public Mono<RescoreResult> rescore(String userId, RescoreRequest request) {
        ScriptConstraints constraints = request.toConstraints();
        return contextProvider.contextFor(userId, constraints)
            .map(context -> rescorer.rescore(request.scriptText(), constraints, request.baselineScore(),
                                             request.baselineDetectorRankings(), context))
            .doOnSuccess(result -> log.info("Draft rescored. platform={} combined={} delta={} actions={}",
                constraints.platform().key(), result.scoreBreakdown().combined(),
                result.scoreBreakdown().deltaFromBaseline(), result.nextActions().size()));
    }
}
