package com.scriptplatform.optimizer.service;

import com.scriptplatform.common.model.ChannelContext;
import com.scriptplatform.common.model.ScriptConstraints;
import reactor.core.publisher.Mono;

/**
 * Supplies competitor and historical inputs for one scoring request. Never errors;
 * missing data is expressed as empty channels.
 */
public interface ChannelContextProvider {

    Mono<ChannelContext> contextFor(String userId, ScriptConstraints constraints);
}
