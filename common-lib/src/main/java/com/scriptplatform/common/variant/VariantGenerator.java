package com.scriptplatform.common.variant;

import com.scriptplatform.common.model.ChannelContext;
import com.scriptplatform.common.model.ScriptDraft;
import com.scriptplatform.common.model.ScriptVariant;
import com.scriptplatform.common.model.Scores;
import com.scriptplatform.common.scoring.Evaluation;
import com.scriptplatform.common.scoring.ScriptEvaluator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores a set of drafts through the shared scoring path and ranks them.
 *
 * <p>Ranks are 1..n by combined score descending; ties go to the lowest id. Expected
 * lift is measured against the bare topic scored the same way, floored at zero.
 */
public final class VariantGenerator {

    private final ScriptEvaluator evaluator;

    public VariantGenerator(ScriptEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public List<ScriptVariant> rank(String batchId, VariantBrief brief,
                                    List<ScriptDraft> drafts, ChannelContext context) {
        double naive = evaluator.evaluate(brief.topic(), brief.constraints(), context, null).combined();

        List<Scored> scored = new ArrayList<>();
        for (ScriptDraft draft : drafts) {
            Evaluation evaluation = evaluator.evaluate(draft.scriptText(), brief.constraints(), context, null);
            scored.add(new Scored(batchId + "-" + draft.styleKey(), draft, evaluation));
        }
        scored.sort(Comparator.comparingDouble((Scored s) -> s.evaluation().combined()).reversed()
            .thenComparing(Scored::id));

        List<ScriptVariant> variants = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Scored s = scored.get(i);
            double lift = Math.max(0.0, Scores.round1(s.evaluation().combined() - naive));
            variants.add(new ScriptVariant(
                s.id(), i + 1, s.draft().styleKey(), s.draft().label(), s.draft().rationale(),
                s.draft().scriptText(), brief.constraints().durationSeconds(),
                s.evaluation().detectorRankings(), s.evaluation().scoreBreakdown(), lift, s.draft().source()));
        }
        return variants;
    }

    private record Scored(String id, ScriptDraft draft, Evaluation evaluation) {}
}
