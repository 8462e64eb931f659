package com.scriptplatform.optimizer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptplatform.common.model.ChannelContext;
import com.scriptplatform.common.model.RescoreResult;
import com.scriptplatform.common.model.ScriptConstraints;
import com.scriptplatform.common.model.ScriptDraft;
import com.scriptplatform.common.model.ScriptVariant;
import com.scriptplatform.common.model.VariantBatch;
import com.scriptplatform.common.model.VariantSource;
import com.scriptplatform.common.rescore.Rescorer;
import com.scriptplatform.common.scoring.ScriptEvaluator;
import com.scriptplatform.common.variant.VariantBrief;
import com.scriptplatform.common.variant.VariantGenerator;
import com.scriptplatform.common.variant.VariantStyle;
import com.scriptplatform.optimizer.dto.RescoreRequest;
import com.scriptplatform.optimizer.generation.GenerationBackend;
import com.scriptplatform.optimizer.generation.GenerationRequest;
import com.scriptplatform.optimizer.generation.HttpGenerationBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class VariantGeneratorServiceTest {

    private static final ChannelContextProvider NO_CHANNELS = (userId, constraints) -> Mono.just(ChannelContext.empty());

    private final ScriptEvaluator evaluator = ScriptEvaluator.standard();

    private VariantGeneratorService service(GenerationBackend backend, Duration timeout) {
        return new VariantGeneratorService(backend, new VariantGenerator(evaluator), NO_CHANNELS,
                                           timeout, Clock.systemUTC());
    }

    private static VariantBrief brief() {
        return VariantBrief.of("3 hook mistakes", null, null, ScriptConstraints.of("youtube_shorts", 45), 3);
    }

    private static ScriptDraft generated(VariantStyle style) {
        return new ScriptDraft(style.key(), style.label(),
            "Here is how to fix your hook in 3 steps, backed by data from 40 videos.\n"
                + "Step 1: cut the intro.\nStep 2: show the result first.\nComment 'HOOK' for the checklist.",
            "generated", VariantSource.GENERATED);
    }

    // ── fallback branch ────────────────────────────────────────────────────

    @Nested
    @DisplayName("fallback")
    class Fallback {

        @Test
        @DisplayName("backend error → full template set, reason recorded")
        void backendError() {
            VariantBatch batch = service(new StubBackend(r -> Mono.error(new IllegalStateException("down"))),
                                         Duration.ofSeconds(1)).generate("user-1", brief()).block();

            assertNotNull(batch);
            assertTrue(batch.generationMeta().usedFallback());
            assertEquals(VariantSource.FALLBACK, batch.generationMeta().source());
            assertEquals("generation_error: IllegalStateException", batch.generationMeta().fallbackReason());
            assertEquals(3, batch.variants().size());
            assertTrue(batch.variants().stream().allMatch(v -> v.source() == VariantSource.FALLBACK));
        }

        @Test
        @DisplayName("backend never answers → timeout fallback within the bound")
        void backendTimeout() {
            VariantBatch batch = service(new StubBackend(r -> Mono.never()), Duration.ofMillis(50))
                .generate("user-1", brief())
                .block(Duration.ofSeconds(5));

            assertNotNull(batch);
            assertEquals("generation_timeout_50ms", batch.generationMeta().fallbackReason());
            assertEquals(3, batch.variants().size());
        }

        @Test
        @DisplayName("unconfigured HTTP backend → unavailable fallback")
        void unconfiguredBackend() {
            HttpGenerationBackend http = new HttpGenerationBackend(WebClient.builder(), new ObjectMapper(),
                                                                   "", "", "script-writer-v1");
            VariantBatch batch = service(http, Duration.ofSeconds(1)).generate("user-1", brief()).block();

            assertNotNull(batch);
            assertTrue(batch.generationMeta().fallbackReason().startsWith("generation_unavailable"));
            assertEquals("deterministic", batch.generationMeta().provider());
        }
    }

    // ── generated branch ───────────────────────────────────────────────────

    @Nested
    @DisplayName("generated")
    class Generated {

        @Test
        @DisplayName("all styles returned → generated source, no fallback")
        void fullyGenerated() {
            GenerationBackend backend = new StubBackend(r -> Mono.just(
                r.styles().stream().map(VariantGeneratorServiceTest::generated).collect(Collectors.toList())));

            VariantBatch batch = service(backend, Duration.ofSeconds(1)).generate("user-1", brief()).block();

            assertNotNull(batch);
            assertFalse(batch.generationMeta().usedFallback());
            assertNull(batch.generationMeta().fallbackReason());
            assertEquals(VariantSource.GENERATED, batch.generationMeta().source());
            assertEquals("stub", batch.generationMeta().provider());
        }

        @Test
        @DisplayName("missing styles are filled from templates and reported")
        void partiallyGenerated() {
            GenerationBackend backend = new StubBackend(r -> Mono.just(List.of(generated(VariantStyle.OUTCOME_PROOF))));

            VariantBatch batch = service(backend, Duration.ofSeconds(1)).generate("user-1", brief()).block();

            assertNotNull(batch);
            assertTrue(batch.generationMeta().usedFallback());
            assertEquals("missing_variant_b,missing_variant_c", batch.generationMeta().fallbackReason());
            ScriptVariant a = batch.variants().stream()
                .filter(v -> v.styleKey().equals("variant_a")).findFirst().orElseThrow();
            assertEquals(VariantSource.GENERATED, a.source());
            assertEquals(2, batch.variants().stream().filter(v -> v.source() == VariantSource.FALLBACK).count());
        }
    }

    // ── end to end ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("3 variants for '3 hook mistakes'; dropping the top variant's opening line lowers its score")
    void generateThenRescore() {
        VariantBatch batch = service(new StubBackend(r -> Mono.error(new IllegalStateException("offline"))),
                                     Duration.ofSeconds(1)).generate("user-1", brief()).block();
        assertNotNull(batch);

        assertEquals(List.of(1, 2, 3), batch.variants().stream().map(ScriptVariant::rank).collect(Collectors.toList()));
        for (ScriptVariant v : batch.variants()) {
            assertTrue(v.scoreBreakdown().combined() >= 0 && v.scoreBreakdown().combined() <= 100);
            assertTrue(v.expectedLiftPoints() >= 0);
        }

        ScriptVariant top = batch.variants().get(0);
        String[] lines = top.scriptText().split("\n");
        String edited = String.join("\n", Arrays.copyOfRange(lines, 1, lines.length));

        RescoreService rescoreService = new RescoreService(new Rescorer(evaluator), NO_CHANNELS);
        RescoreResult result = rescoreService.rescore("user-1", new RescoreRequest(edited, "youtube_shorts", 45,
            null, null, null, null, top.scoreBreakdown().combined(), top.detectorRankings())).block();

        assertNotNull(result);
        assertTrue(result.scoreBreakdown().deltaFromBaseline() < 0);
        assertTrue(result.nextActions().stream().anyMatch(a -> a.detectorKey().startsWith("hook")));
    }

    private static final class StubBackend implements GenerationBackend {

        private final Function<GenerationRequest, Mono<List<ScriptDraft>>> behaviour;

        StubBackend(Function<GenerationRequest, Mono<List<ScriptDraft>>> behaviour) {
            this.behaviour = behaviour;
        }

        @Override
        public Mono<List<ScriptDraft>> generate(GenerationRequest request) {
            return behaviour.apply(request);
        }

        @Override
        public String provider() {
            return "stub";
        }

        @Override
        public String model() {
            return "stub-1";
        }
    }
}
