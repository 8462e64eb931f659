package com.scriptplatform.common.model;

/**
 * Unscored candidate text for one variant style, before it enters the scoring path.
 */
public record ScriptDraft(
    String styleKey,
    String label,
    String scriptText,
    String rationale,
    VariantSource source
) {}
