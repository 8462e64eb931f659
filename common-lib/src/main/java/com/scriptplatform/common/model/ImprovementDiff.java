package com.scriptplatform.common.model;

import java.util.List;

public record ImprovementDiff(
    Double combinedBefore,
    double combinedAfter,
    Double combinedDelta,
    List<DetectorDelta> detectors
) {
    public ImprovementDiff {
        detectors = detectors == null ? List.of() : List.copyOf(detectors);
    }
}
