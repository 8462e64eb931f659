package com.scriptplatform.common.model;

import java.time.Instant;
import java.util.List;

public record VariantBatch(
    String batchId,
    Instant generatedAt,
    GenerationMeta generationMeta,
    List<ScriptVariant> variants
) {
    public VariantBatch {
        variants = variants == null ? List.of() : List.copyOf(variants);
    }
}
