package com.scriptplatform.common.model;

/**
 * Targeted rewrite of one script line.
 *
 * <p>{@code lineNumber} is 1-based over the raw text lines (blank lines included), so a
 * client can splice {@code suggestedLine} into the original text without re-parsing.
 */
public record LineLevelEdit(
    String detectorKey,
    String detectorLabel,
    int lineNumber,
    String originalLine,
    String suggestedLine,
    String reason
) {}
