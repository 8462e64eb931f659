package com.scriptplatform.optimizer.service;

import com.scriptplatform.common.exception.ValidationException;
import com.scriptplatform.common.model.ChannelContext;
import com.scriptplatform.common.model.CompetitorBenchmark;
import com.scriptplatform.common.model.Confidence;
import com.scriptplatform.common.model.HistoricalBaseline;
import com.scriptplatform.common.model.RescoreResult;
import com.scriptplatform.common.rescore.Rescorer;
import com.scriptplatform.common.scoring.ScriptEvaluator;
import com.scriptplatform.optimizer.dto.RescoreRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

class RescoreServiceTest {

    private static final String SCRIPT = "Here is how to fix your hook in 3 steps.\n"
        + "Step 1: open on the result.\nStep 2: prove it.\nComment 'HOOK' and I will send the checklist.";

    @Test
    @DisplayName("blank script surfaces a ValidationException")
    void blankScript() {
        RescoreService service = new RescoreService(new Rescorer(ScriptEvaluator.standard()),
            (userId, constraints) -> Mono.just(ChannelContext.empty()));

        assertThrows(ValidationException.class, () -> service.rescore("u",
            new RescoreRequest(" ", "youtube", 45, null, null, null, null, null, null)).block());
    }

    @Test
    @DisplayName("cold start → low confidence; well-supported channels → high")
    void confidenceFollowsChannels() {
        Rescorer rescorer = new Rescorer(ScriptEvaluator.standard());
        RescoreRequest request = new RescoreRequest(SCRIPT, "youtube", 45, null, null, null, null, null, null);

        RescoreResult cold = new RescoreService(rescorer, (u, c) -> Mono.just(ChannelContext.empty()))
            .rescore("u", request).block();
        RescoreResult warm = new RescoreService(rescorer, (u, c) -> Mono.just(new ChannelContext(
                new CompetitorBenchmark(40, 6, 60.0), new HistoricalBaseline(12, 2.0, 55.0))))
            .rescore("u", request).block();

        assertNotNull(cold);
        assertNotNull(warm);
        assertEquals(Confidence.LOW, cold.scoreBreakdown().confidence());
        assertEquals(50.0, cold.scoreBreakdown().competitorMetrics());
        assertEquals(Confidence.HIGH, warm.scoreBreakdown().confidence());
        assertEquals(40, warm.scoreBreakdown().sampleCounts().get("competitor_metrics"));
    }
}
