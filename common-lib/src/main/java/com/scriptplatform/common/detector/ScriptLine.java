package com.scriptplatform.common.detector;

import java.util.Locale;

/**
 * One spoken unit of a script.
 *
 * @param lineNumber 1-based raw line number the text came from (blank lines counted)
 * @param text       trimmed line text
 * @param wordCount  number of word tokens
 */
public record ScriptLine(
    int lineNumber,
    String text,
    int wordCount
) {
    public String lower() {
        return text.toLowerCase(Locale.ROOT);
    }
}
