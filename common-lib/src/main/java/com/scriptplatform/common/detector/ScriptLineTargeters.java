package com.scriptplatform.common.detector;

import com.scriptplatform.common.model.FormatType;
import com.scriptplatform.common.model.ScriptConstraints;

import java.util.Locale;
import java.util.Optional;

/**
 * Line targeters for the standard detectors. Each names at most one line;
 * {@code shareability} has none because no single line owns it.
 */
final class ScriptLineTargeters {

    private ScriptLineTargeters() {}

    static Optional<LineSuggestion> hook(ScriptText script, ScriptConstraints constraints) {
        ScriptLine first = script.first();
        if (first == null) {
            return Optional.empty();
        }
        return Optional.of(new LineSuggestion(first,
            "I tested this and saw the result: " + stripPeriod(first.text()) + ". Here is why it works.",
            "open on a concrete result with proof instead of setup"));
    }

    static Optional<LineSuggestion> timeToValue(ScriptText script, ScriptConstraints constraints) {
        ScriptLine first = script.first();
        if (first == null) {
            return Optional.empty();
        }
        return Optional.of(new LineSuggestion(first,
            "Within one line: the outcome is " + stripPeriod(first.text()).toLowerCase(Locale.ROOT)
                + " with proof in the same sentence.",
            "state the payoff in the first line"));
    }

    static Optional<LineSuggestion> openLoop(ScriptText script, ScriptConstraints constraints) {
        if (script.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(new LineSuggestion(script.lines().get(1),
            "In a few seconds, I will show the exact before/after line that changed results.",
            "tease what is coming so viewers stay for it"));
    }

    static Optional<LineSuggestion> deadZone(ScriptText script, ScriptConstraints constraints) {
        if (script.isEmpty()) {
            return Optional.empty();
        }
        int longest = 0;
        for (int i = 1; i < script.size(); i++) {
            if (script.lines().get(i).wordCount() > script.lines().get(longest).wordCount()) {
                longest = i;
            }
        }
        ScriptLine line = script.lines().get(longest);
        if (!ScriptDetectors.isDeadZone(line, script.lineSeconds(longest, constraints.durationSeconds()))) {
            return Optional.empty();
        }
        return Optional.of(new LineSuggestion(line,
            "Split this into two shorter lines and attach one concrete visual cue to each.",
            "longest line runs without a new beat"));
    }

    static Optional<LineSuggestion> patternInterrupt(ScriptText script, ScriptConstraints constraints) {
        if (script.size() < 3) {
            return Optional.empty();
        }
        int position = Math.min(Math.max(2, script.size() / 2), script.size());
        String cadence = constraints.formatType() == FormatType.SHORT_FORM
            ? "every 6-10 seconds"
            : "every 20-35 seconds";
        return Optional.of(new LineSuggestion(script.lines().get(position - 1),
            "[zoom in] Insert a pattern interrupt here (caption shift, zoom or cut) " + cadence + ".",
            "mid-script is where attention sags first"));
    }

    static Optional<LineSuggestion> cta(ScriptText script, ScriptConstraints constraints) {
        ScriptLine last = script.last();
        if (last == null) {
            return Optional.empty();
        }
        return Optional.of(new LineSuggestion(last,
            "Use one CTA only: 'Comment \"PLAN\" and I will send the exact framework.'",
            "close with a single specific ask"));
    }

    private static String stripPeriod(String text) {
        String trimmed = text.trim();
        while (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
