package com.scriptplatform.optimizer.dto;

import com.scriptplatform.common.model.ScriptConstraints;
import com.scriptplatform.common.variant.VariantBrief;

/**
 * Body of {@code POST /api/v1/optimizer/variants}. Only {@code topic} is required.
 */
public record VariantRequest(
    String topic,
    String audience,
    String objective,
    String platform,
    Integer durationSeconds,
    String tone,
    String hookStyle,
    String ctaStyle,
    String pacingDensity,
    Integer n
) {
    public VariantBrief toBrief() {
        ScriptConstraints constraints =
            ScriptConstraints.of(platform, durationSeconds, tone, hookStyle, ctaStyle, pacingDensity);
        return VariantBrief.of(topic, audience, objective, constraints, n);
    }
}
