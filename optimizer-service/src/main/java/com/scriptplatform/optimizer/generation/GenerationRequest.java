package com.scriptplatform.optimizer.generation;

import com.scriptplatform.common.variant.VariantBrief;
import com.scriptplatform.common.variant.VariantStyle;

import java.util.List;

/**
 * What the generation backend is asked for: one script per style.
 */
public record GenerationRequest(
    VariantBrief brief,
    List<VariantStyle> styles
) {
    public GenerationRequest {
        styles = List.copyOf(styles);
    }
}
