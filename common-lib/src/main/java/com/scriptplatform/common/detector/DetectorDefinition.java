package com.scriptplatform.common.detector;

import java.util.Objects;

/**
 * Registry entry describing one detector and the action it drives.
 *
 * @param key             stable key, e.g. {@code hook_strength}
 * @param priority        1 is most important; breaks score and gap ties
 * @param weight          share of the platform channel contributed by this detector
 * @param floor           score reported when the detector throws
 * @param actionThreshold scores below this emit a next action
 * @param targeter        optional; {@code null} when the detector never names a line
 */
public record DetectorDefinition(
    String key,
    String label,
    int priority,
    double weight,
    double floor,
    double actionThreshold,
    String actionTitle,
    String actionWhy,
    Detector detector,
    LineTargeter targeter
) {
    public DetectorDefinition {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(detector, "detector");
        if (weight < 0) {
            throw new IllegalArgumentException("detector weight must be >= 0: " + key);
        }
    }

    public DetectorDefinition withActionThreshold(double threshold) {
        return new DetectorDefinition(key, label, priority, weight, floor, threshold,
                                      actionTitle, actionWhy, detector, targeter);
    }
}
