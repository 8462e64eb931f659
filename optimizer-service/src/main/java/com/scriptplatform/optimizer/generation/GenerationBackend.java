package com.scriptplatform.optimizer.generation;

import com.scriptplatform.common.model.ScriptDraft;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * External text generator. Any error signal is treated by callers as "use the template
 * fallback"; implementations need not retry.
 */
public interface GenerationBackend {

    Mono<List<ScriptDraft>> generate(GenerationRequest request);

    String provider();

    String model();
}
