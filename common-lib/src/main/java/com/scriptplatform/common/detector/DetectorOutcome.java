package com.scriptplatform.common.detector;

import java.util.List;

/**
 * Raw output of a single {@link Detector}: an unclamped score and its evidence.
 */
public record DetectorOutcome(
    double score,
    List<String> evidence
) {
    public DetectorOutcome {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
