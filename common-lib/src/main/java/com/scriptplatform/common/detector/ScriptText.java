package com.scriptplatform.common.detector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed view of a script shared by every detector of one evaluation.
 *
 * <p>Non-blank raw lines become {@link ScriptLine}s. A script written as a single
 * paragraph is split into sentences instead, all carrying line number 1, so pacing
 * detectors still see individual beats. Spoken time is apportioned to lines by word
 * count over the planned duration.
 */
public final class ScriptText {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern WORD = Pattern.compile("\\w+");

    private final String raw;
    private final List<ScriptLine> lines;
    private final int totalWords;

    private ScriptText(String raw, List<ScriptLine> lines) {
        this.raw = raw;
        this.lines = Collections.unmodifiableList(lines);
        this.totalWords = lines.stream().mapToInt(ScriptLine::wordCount).sum();
    }

    public static ScriptText parse(String scriptText) {
        String raw = scriptText == null ? "" : scriptText;
        String[] rawLines = LINE_BREAK.split(raw, -1);

        List<ScriptLine> lines = new ArrayList<>();
        for (int i = 0; i < rawLines.length; i++) {
            String text = rawLines[i].trim();
            if (!text.isEmpty()) {
                lines.add(new ScriptLine(i + 1, text, countWords(text)));
            }
        }

        if (lines.size() == 1) {
            ScriptLine only = lines.get(0);
            String[] sentences = SENTENCE_BREAK.split(only.text());
            if (sentences.length > 1) {
                lines.clear();
                for (String sentence : sentences) {
                    String text = sentence.trim();
                    if (!text.isEmpty()) {
                        lines.add(new ScriptLine(only.lineNumber(), text, countWords(text)));
                    }
                }
            }
        }
        return new ScriptText(raw, lines);
    }

    public static int countWords(String text) {
        if (text == null) {
            return 0;
        }
        Matcher matcher = WORD.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    public String raw() {
        return raw;
    }

    public String lower() {
        return raw.toLowerCase(Locale.ROOT);
    }

    public List<ScriptLine> lines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public ScriptLine first() {
        return lines.isEmpty() ? null : lines.get(0);
    }

    public ScriptLine last() {
        return lines.isEmpty() ? null : lines.get(lines.size() - 1);
    }

    public int totalWords() {
        return totalWords;
    }

    /** Parsed units taken from raw line {@code lineNumber}; more than one for a split paragraph. */
    public int unitsOnLine(int lineNumber) {
        int count = 0;
        for (ScriptLine line : lines) {
            if (line.lineNumber() == lineNumber) {
                count++;
            }
        }
        return count;
    }

    /** Seconds into the video at which line {@code index} starts. */
    public double startSeconds(int index, int durationSeconds) {
        if (totalWords == 0) {
            return 0.0;
        }
        int wordsBefore = 0;
        for (int i = 0; i < index && i < lines.size(); i++) {
            wordsBefore += lines.get(i).wordCount();
        }
        return (double) durationSeconds * wordsBefore / totalWords;
    }

    /** Seconds spent speaking line {@code index}. */
    public double lineSeconds(int index, int durationSeconds) {
        if (totalWords == 0) {
            return 0.0;
        }
        return (double) durationSeconds * lines.get(index).wordCount() / totalWords;
    }
}
