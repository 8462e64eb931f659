package com.scriptplatform.common.detector;

import com.scriptplatform.common.model.DetectorResult;
import com.scriptplatform.common.model.ScriptConstraints;
import com.scriptplatform.common.model.Scores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every detector of a {@link DetectorRegistry} over one script.
 *
 * <p>A detector that throws is isolated: it reports its floor score with
 * {@code failed=true} and the remaining detectors still run. Results are ordered by
 * score descending, then by detector priority.
 */
public final class DetectorSuite {

    private static final Logger log = LoggerFactory.getLogger(DetectorSuite.class);

    private final DetectorRegistry registry;

    public DetectorSuite(DetectorRegistry registry) {
        this.registry = registry;
    }

    public static DetectorSuite standard() {
        return new DetectorSuite(DetectorRegistry.standard());
    }

    public DetectorRegistry registry() {
        return registry;
    }

    public List<DetectorResult> evaluate(String scriptText, ScriptConstraints constraints) {
        return evaluate(ScriptText.parse(scriptText), constraints);
    }

    public List<DetectorResult> evaluate(ScriptText script, ScriptConstraints constraints) {
        List<DetectorResult> results = new ArrayList<>(registry.size());
        for (DetectorDefinition definition : registry.definitions()) {
            results.add(run(definition, script, constraints));
        }
        results.sort(Comparator.comparingDouble(DetectorResult::score).reversed()
            .thenComparingInt(this::priorityOf));
        return results;
    }

    private DetectorResult run(DetectorDefinition definition, ScriptText script, ScriptConstraints constraints) {
        try {
            DetectorOutcome outcome = definition.detector().evaluate(script, constraints);
            double score = Scores.round1(Scores.clamp(outcome.score()));
            return new DetectorResult(definition.key(), definition.label(), score, outcome.evidence(), false);
        } catch (RuntimeException e) {
            log.warn("Detector failed, using floor score. detector={} floor={} error={}",
                     definition.key(), definition.floor(), e.getMessage());
            return new DetectorResult(definition.key(), definition.label(), definition.floor(),
                                      List.of("detector failed: " + e.getClass().getSimpleName()), true);
        }
    }

    private int priorityOf(DetectorResult result) {
        return registry.find(result.detectorKey())
            .map(DetectorDefinition::priority)
            .orElse(Integer.MAX_VALUE);
    }
}
