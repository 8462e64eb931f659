package com.scriptplatform.common.rescore;

import com.scriptplatform.common.detector.DetectorDefinition;
import com.scriptplatform.common.detector.DetectorRegistry;
import com.scriptplatform.common.model.DetectorResult;
import com.scriptplatform.common.model.NextAction;
import com.scriptplatform.common.model.Scores;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One action per detector scoring below its action threshold, ranked by threshold gap
 * descending, then detector priority. The full list is returned.
 */
public final class NextActionPlanner {

    private NextActionPlanner() {}

    public static List<NextAction> plan(List<DetectorResult> rankings, DetectorRegistry registry) {
        List<NextAction> actions = new ArrayList<>();
        for (DetectorResult result : rankings) {
            Optional<DetectorDefinition> definition = registry.find(result.detectorKey());
            if (definition.isEmpty()) {
                continue;
            }
            DetectorDefinition d = definition.get();
            double gap = d.actionThreshold() - result.score();
            if (gap > 0) {
                actions.add(new NextAction(d.key(), d.actionTitle(), whyFor(d, result),
                                           Scores.round1(gap), d.priority()));
            }
        }
        actions.sort(Comparator.comparingDouble(NextAction::thresholdGap).reversed()
            .thenComparingInt(NextAction::priority));
        return actions;
    }

    private static String whyFor(DetectorDefinition definition, DetectorResult result) {
        if (result.evidence().isEmpty()) {
            return definition.actionWhy();
        }
        return definition.actionWhy() + " (" + result.evidence().get(0) + ")";
    }
}
