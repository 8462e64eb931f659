package com.scriptplatform.optimizer.service;

import com.scriptplatform.common.exception.GenerationBackendUnavailableException;
import com.scriptplatform.common.model.GenerationMeta;
import com.scriptplatform.common.model.ScriptDraft;
import com.scriptplatform.common.model.ScriptVariant;
import com.scriptplatform.common.model.VariantBatch;
import com.scriptplatform.common.model.VariantSource;
import com.scriptplatform.common.variant.TemplateScriptGenerator;
import com.scriptplatform.common.variant.VariantBrief;
import com.scriptplatform.common.variant.VariantGenerator;
import com.scriptplatform.common.variant.VariantStyle;
import com.scriptplatform.optimizer.generation.GenerationBackend;
import com.scriptplatform.optimizer.generation.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Generation entry point: one time-bounded backend call, one fallback branch.
 *
 * <p>Styles the backend did not return are filled from {@link TemplateScriptGenerator};
 * a timeout or error replaces the whole set. Either way every draft goes through the same
 * scoring path and the batch records which path was taken. This service never fails
 * because of the backend.
 */
@Service
public class VariantGeneratorService {

    private static final Logger log = LoggerFactory.getLogger(VariantGeneratorService.class);

    private final GenerationBackend backend;
    private final VariantGenerator variantGenerator;
    private final ChannelContextProvider contextProvider;
    private final Duration timeout;
    private final Clock clock;

    public VariantGeneratorService(GenerationBackend backend,
                                   VariantGenerator variantGenerator,
                                   ChannelContextProvider contextProvider,
                                   @Value("${generation.backend.timeout-ms:4000}") long timeoutMs) {
        this(backend, variantGenerator, contextProvider, Duration.ofMillis(timeoutMs), Clock.systemUTC());
    }

    VariantGeneratorService(GenerationBackend backend,
                            VariantGenerator variantGenerator,
                            ChannelContextProvider contextProvider,
                            Duration timeout,
                            Clock clock) {
        this.backend = backend;
        this.variantGenerator = variantGenerator;
        this.contextProvider = contextProvider;
        this.timeout = timeout;
        this.clock = clock;
    }

    public Mono<VariantBatch> generate(String userId, VariantBrief brief) {
        String batchId = UUID.randomUUID().toString();
        List<VariantStyle> styles = VariantStyle.first(brief.count());

        Mono<DraftSet> drafts = backend.generate(new GenerationRequest(brief, styles))
            .timeout(timeout)
            .map(generated -> merge(brief, styles, generated))
            .onErrorResume(e -> {
                String reason = fallbackReason(e);
                log.warn("Generation failed, using template fallback. batchId={} reason={}", batchId, reason);
                return Mono.just(new DraftSet(TemplateScriptGenerator.draftAll(brief), GenerationMeta.fallback(reason)));
            });

        return Mono.zip(drafts, contextProvider.contextFor(userId, brief.constraints()))
            .map(tuple -> {
                DraftSet set = tuple.getT1();
                List<ScriptVariant> variants = variantGenerator.rank(batchId, brief, set.drafts(), tuple.getT2());
                return new VariantBatch(batchId, Instant.now(clock), set.meta(), variants);
            })
            .doOnSuccess(batch -> log.info("Variant batch generated. batchId={} count={} source={} usedFallback={}",
                batchId, batch.variants().size(), batch.generationMeta().source().key(),
                batch.generationMeta().usedFallback()));
    }

    private DraftSet merge(VariantBrief brief, List<VariantStyle> styles, List<ScriptDraft> generated) {
        Map<String, ScriptDraft> byStyle = new LinkedHashMap<>();
        for (ScriptDraft draft : generated) {
            byStyle.putIfAbsent(draft.styleKey(), draft);
        }

        List<ScriptDraft> drafts = new ArrayList<>(styles.size());
        List<String> missing = new ArrayList<>();
        for (VariantStyle style : styles) {
            ScriptDraft draft = byStyle.get(style.key());
            if (draft == null) {
                missing.add("missing_" + style.key());
                drafts.add(TemplateScriptGenerator.draft(style, brief));
            } else {
                drafts.add(draft);
            }
        }

        if (missing.isEmpty()) {
            return new DraftSet(drafts, new GenerationMeta(GenerationMeta.MODE, backend.provider(), backend.model(),
                                                           false, null, VariantSource.GENERATED));
        }
        if (missing.size() == styles.size()) {
            return new DraftSet(drafts, GenerationMeta.fallback(String.join(",", missing)));
        }
        return new DraftSet(drafts, new GenerationMeta(GenerationMeta.MODE, backend.provider(), backend.model(),
                                                       true, String.join(",", missing), VariantSource.FALLBACK));
    }

    private String fallbackReason(Throwable e) {
        if (e instanceof TimeoutException) {
            return "generation_timeout_" + timeout.toMillis() + "ms";
        }
        if (e instanceof GenerationBackendUnavailableException) {
            return "generation_unavailable: " + e.getMessage();
        }
        return "generation_error: " + e.getClass().getSimpleName();
    }

    private record DraftSet(List<ScriptDraft> drafts, GenerationMeta meta) {}
}
