package com.scriptplatform.history.service;

import com.scriptplatform.common.model.ActualMetrics;
import com.scriptplatform.common.model.ChannelContext;
import com.scriptplatform.common.model.OutcomeInput;
import com.scriptplatform.common.model.RescoreResult;
import com.scriptplatform.common.model.ScriptConstraints;
import com.scriptplatform.common.model.SnapshotInput;
import com.scriptplatform.common.rescore.Rescorer;
import com.scriptplatform.common.scoring.ScriptEvaluator;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Builders for store inputs backed by real rescore output. */
public final class DraftFixtures {

    public static final ScriptConstraints SHORTS = ScriptConstraints.of("youtube_shorts", 45);

    public static final String SCRIPT = "Here is how to fix your hook in 3 steps.\n"
        + "Step 1: open on the result, not the intro.\n"
        + "Step 2: show proof in the first 5 seconds.\n"
        + "Comment 'HOOK' and I will send the checklist.";

    /** 1M views, 50k likes, 35 s watch time → actual score 82.0. */
    public static final ActualMetrics STRONG_METRICS = new ActualMetrics(1_000_000, 50_000, 0, 0, 0, 35.0);

    public static final ActualMetrics ZERO_METRICS = new ActualMetrics(0, 0, 0, 0, 0, 0.0);

    private static final Rescorer RESCORER = new Rescorer(ScriptEvaluator.standard());

    private DraftFixtures() {}

    public static String newUser() {
        return "user-" + UUID.randomUUID();
    }

    public static RescoreResult rescore(String text) {
        return RESCORER.rescore(text, SHORTS, null, null, ChannelContext.empty());
    }

    public static SnapshotInput input(String text) {
        return new SnapshotInput("youtube", null, null, text, null, rescore(text));
    }

    public static SnapshotInput input(String text, Double baseline) {
        return new SnapshotInput("youtube", "item-1", "batch-variant_a", text, baseline, rescore(text));
    }

    public static OutcomeInput outcome(Long snapshotId, ActualMetrics metrics, Double predicted, Instant postedAt) {
        return new OutcomeInput(snapshotId, "youtube", metrics, List.of(), postedAt, predicted, "now");
    }
}
