package com.scriptplatform.common.variant;

import com.scriptplatform.common.exception.ValidationException;
import com.scriptplatform.common.model.ScriptConstraints;

/**
 * What a generation batch is about.
 *
 * @param count number of variants, clamped to [1, {@link VariantStyle#MAX_VARIANTS}]
 */
public record VariantBrief(
    String topic,
    String audience,
    String objective,
    ScriptConstraints constraints,
    int count
) {
    public static final String DEFAULT_AUDIENCE = "solo creators";
    public static final String DEFAULT_OBJECTIVE = "higher retention and shares";

    public VariantBrief {
        if (topic == null || topic.isBlank()) {
            throw new ValidationException("generate_variants", "topic is required");
        }
        topic = topic.strip();
        audience = audience == null || audience.isBlank() ? DEFAULT_AUDIENCE : audience.strip();
        objective = objective == null || objective.isBlank() ? DEFAULT_OBJECTIVE : objective.strip();
        if (constraints == null) {
            constraints = ScriptConstraints.of(null, null);
        }
        count = Math.max(1, Math.min(VariantStyle.MAX_VARIANTS, count));
    }

    public static VariantBrief of(String topic, String audience, String objective,
                                  ScriptConstraints constraints, Integer count) {
        return new VariantBrief(topic, audience, objective, constraints,
                                count == null ? VariantStyle.DEFAULT_VARIANTS : count);
    }
}
