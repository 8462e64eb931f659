package com.scriptplatform.common.rescore;

import com.scriptplatform.common.detector.DetectorDefinition;
import com.scriptplatform.common.detector.DetectorRegistry;
import com.scriptplatform.common.detector.LineSuggestion;
import com.scriptplatform.common.detector.ScriptText;
import com.scriptplatform.common.model.DetectorResult;
import com.scriptplatform.common.model.LineLevelEdit;
import com.scriptplatform.common.model.ScriptConstraints;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Line edits for below-threshold detectors that can name a specific line.
 * A detector without a targeter, or whose targeter finds nothing, emits no edit.
 * Neither does a target inside a raw line that was split into sentences: an edit
 * replaces a whole raw line, so a sentence-level target cannot be applied safely.
 * Edits are ordered by line number.
 */
public final class LineEditPlanner {

    private LineEditPlanner() {}

    public static List<LineLevelEdit> plan(ScriptText script,
                                           ScriptConstraints constraints,
                                           List<DetectorResult> rankings,
                                           DetectorRegistry registry) {
        List<LineLevelEdit> edits = new ArrayList<>();
        for (DetectorResult result : rankings) {
            Optional<DetectorDefinition> found = registry.find(result.detectorKey());
            if (found.isEmpty()) {
                continue;
            }
            DetectorDefinition definition = found.get();
            if (definition.targeter() == null || result.score() >= definition.actionThreshold()) {
                continue;
            }
            definition.targeter().target(script, constraints)
                .filter(suggestion -> script.unitsOnLine(suggestion.line().lineNumber()) == 1)
                .map(suggestion -> toEdit(definition, suggestion))
                .ifPresent(edits::add);
        }
        edits.sort(Comparator.comparingInt(LineLevelEdit::lineNumber));
        return edits;
    }

    private static LineLevelEdit toEdit(DetectorDefinition definition, LineSuggestion suggestion) {
        return new LineLevelEdit(definition.key(), definition.label(), suggestion.line().lineNumber(),
                                 suggestion.line().text(), suggestion.suggestedLine(), suggestion.reason());
    }
}
