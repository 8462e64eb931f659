package com.scriptplatform.common.model;

/**
 * Records how a batch was produced. Falling back is not an error; it is reported here.
 *
 * @param usedFallback   true when at least one variant came from the template generator
 * @param fallbackReason why the fallback was taken, {@code null} when it was not
 * @param source         {@link VariantSource#GENERATED} only when every variant came from the backend
 */
public record GenerationMeta(
    String mode,
    String provider,
    String model,
    boolean usedFallback,
    String fallbackReason,
    VariantSource source
) {
    public static final String MODE = "ai_first_fallback";
    public static final String TEMPLATE_PROVIDER = "deterministic";
    public static final String TEMPLATE_MODEL = "deterministic-v1";

    public static GenerationMeta fallback(String reason) {
        return new GenerationMeta(MODE, TEMPLATE_PROVIDER, TEMPLATE_MODEL, true, reason, VariantSource.FALLBACK);
    }
}
