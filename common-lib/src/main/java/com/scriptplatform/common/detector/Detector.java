package com.scriptplatform.common.detector;

import com.scriptplatform.common.model.ScriptConstraints;

/**
 * One script-quality scoring function. Implementations must be pure: no logging,
 * no I/O, no shared mutable state.
 */
@FunctionalInterface
public interface Detector {

    DetectorOutcome evaluate(ScriptText script, ScriptConstraints constraints);
}
