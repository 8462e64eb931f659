package com.scriptplatform.common.detector;

/**
 * A rewrite proposed for one line by a {@link LineTargeter}.
 */
public record LineSuggestion(
    ScriptLine line,
    String suggestedLine,
    String reason
) {}
