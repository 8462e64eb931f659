package com.scriptplatform.common.detector;

import com.scriptplatform.common.model.ScriptConstraints;

import java.util.Optional;

/**
 * Points a failing detector at the one line most responsible for its score.
 * Returns empty when no single line can be named.
 */
@FunctionalInterface
public interface LineTargeter {

    Optional<LineSuggestion> target(ScriptText script, ScriptConstraints constraints);
}
