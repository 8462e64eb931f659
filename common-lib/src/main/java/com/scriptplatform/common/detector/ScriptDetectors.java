package com.scriptplatform.common.detector;

import com.scriptplatform.common.model.FormatType;
import com.scriptplatform.common.model.ScriptConstraints;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The standard detector set. Each detector is a pure static function over a parsed
 * {@link ScriptText}; raw scores may leave [0,100] and are clamped by the suite.
 *
 * <p>Detectors, in priority order:
 * <ol>
 *   <li>{@code hook_strength}      curiosity and proof signal in the first line</li>
 *   <li>{@code time_to_value}      how soon the payoff is announced</li>
 *   <li>{@code open_loops}         teasers that hold viewers to the end</li>
 *   <li>{@code dead_zones}         overly long stretches without a beat</li>
 *   <li>{@code pattern_interrupts} beat density against the platform cadence</li>
 *   <li>{@code cta_style}          a single clear call to action at the close</li>
 *   <li>{@code shareability}       direct address, relatability and share triggers</li>
 * </ol>
 */
public final class ScriptDetectors {

    public static final String HOOK_STRENGTH = "hook_strength";
    public static final String TIME_TO_VALUE = "time_to_value";
    public static final String OPEN_LOOPS = "open_loops";
    public static final String DEAD_ZONES = "dead_zones";
    public static final String PATTERN_INTERRUPTS = "pattern_interrupts";
    public static final String CTA_STYLE = "cta_style";
    public static final String SHAREABILITY = "shareability";

    static final double DEAD_ZONE_SECONDS = 12.0;
    static final int DEAD_ZONE_WORDS = 28;
    static final double LONG_BEAT_SECONDS = 8.0;

    private static final Pattern CURIOSITY =
        Pattern.compile("\\b(how|why|secret|mistakes?|stop|miss|never|truth|nobody|wrong)\\b");
    private static final Pattern PROOF =
        Pattern.compile("\\b(i tested|i used|i grew|we tried|proof|results?|saw|data)\\b");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern FILLER_START =
        Pattern.compile("^(so|hey|hi|hello|welcome|today|in this video|um|okay)\\b");
    private static final Pattern SECOND_PERSON_WORD = Pattern.compile("\\byou\\b");

    private static final List<Pattern> VALUE_SIGNALS = List.of(
        Pattern.compile("\\bhere('?s| is) (the|what|how)\\b"),
        Pattern.compile("\\b(\\d+|three|four|five)[- ](things|steps?|rules?|mistakes?|ways?|tips?)\\b"),
        Pattern.compile("\\bhow to\\b"),
        Pattern.compile("\\bthis is why\\b"),
        Pattern.compile("\\bframework\\b"),
        Pattern.compile("\\bstep (1|one)\\b")
    );

    private static final Pattern OPEN_LOOP = Pattern.compile(
        "\\b(in a second|by the end|stick around|coming up|stay (to|until) the end|before we get to"
            + "|later in this video|don't skip|wait for it|i will show|i'll show|in a few seconds)\\b");

    private static final Pattern BRACKET_CUE =
        Pattern.compile("[\\[(]\\s*(cut|zoom|b-roll|broll|text|caption|on[- ]screen)[^\\])]*[\\])]");
    private static final Pattern SPOKEN_CUE =
        Pattern.compile("\\b(cut to|zoom in|on screen|b-roll|pattern interrupt)\\b");

    private static final Map<String, List<Pattern>> CTA_STYLES = new LinkedHashMap<>();

    static {
        CTA_STYLES.put("comment_prompt", List.of(
            Pattern.compile("\\bcomment\\b"),
            Pattern.compile("\\bdrop (a|your)\\b"),
            Pattern.compile("\\blet me know\\b"),
            Pattern.compile("\\btell me\\b")));
        CTA_STYLES.put("subscribe_follow", List.of(
            Pattern.compile("\\bsubscribe\\b"),
            Pattern.compile("\\bfollow\\b"),
            Pattern.compile("\\bturn on notifications\\b")));
        CTA_STYLES.put("save_share", List.of(
            Pattern.compile("\\bsave\\b"),
            Pattern.compile("\\bshare\\b"),
            Pattern.compile("\\bsend (this|it)\\b")));
        CTA_STYLES.put("link_bio", List.of(
            Pattern.compile("\\blink in (bio|description)\\b"),
            Pattern.compile("\\bcheck the link\\b")));
    }

    private static final Pattern SECOND_PERSON = Pattern.compile("\\b(you|your|you're)\\b");
    private static final Pattern RELATABLE = Pattern.compile("\\b(most (people|creators)|everyone|nobody|we all)\\b");
    private static final Pattern LIST_STRUCTURE =
        Pattern.compile("\\bstep \\d+\\b|\\b(\\d+|three|four|five) (things|steps|ways|mistakes|tips)\\b");
    private static final Pattern SHARE_TRIGGER = Pattern.compile("\\b(send (this|it)|share|tag|save this)\\b");
    private static final Pattern CONTRAST = Pattern.compile("\\b(instead|stop|not|never|myth)\\b");

    private ScriptDetectors() {}

    public static List<DetectorDefinition> standardDefinitions() {
        return List.of(
            new DetectorDefinition(HOOK_STRENGTH, "Hook strength", 1, 0.30, 0.0, 65.0,
                "Sharpen the hook",
                "The first line decides whether viewers stay; lead with curiosity or proof.",
                ScriptDetectors::hookStrength, ScriptLineTargeters::hook),
            new DetectorDefinition(TIME_TO_VALUE, "Time to value", 2, 0.10, 0.0, 60.0,
                "Deliver the payoff sooner",
                "Viewers leave when the promised value arrives late.",
                ScriptDetectors::timeToValue, ScriptLineTargeters::timeToValue),
            new DetectorDefinition(OPEN_LOOPS, "Open loops", 3, 0.10, 0.0, 55.0,
                "Add an open loop",
                "A teaser for what is coming keeps viewers watching to the end.",
                ScriptDetectors::openLoops, ScriptLineTargeters::openLoop),
            new DetectorDefinition(DEAD_ZONES, "Dead zones", 4, 0.15, 0.0, 60.0,
                "Remove dead zones",
                "Long stretches without a new beat are where retention drops.",
                ScriptDetectors::deadZones, ScriptLineTargeters::deadZone),
            new DetectorDefinition(PATTERN_INTERRUPTS, "Pattern interrupts", 5, 0.10, 0.0, 55.0,
                "Add pattern interrupts",
                "Visual or verbal resets at the platform cadence hold attention.",
                ScriptDetectors::patternInterrupts, ScriptLineTargeters::patternInterrupt),
            new DetectorDefinition(CTA_STYLE, "CTA style", 6, 0.10, 20.0, 60.0,
                "Close with one clear CTA",
                "A single specific ask converts better than none or several.",
                ScriptDetectors::ctaStyle, ScriptLineTargeters::cta),
            new DetectorDefinition(SHAREABILITY, "Shareability", 7, 0.15, 0.0, 55.0,
                "Make it worth sharing",
                "Direct address and a share trigger turn viewers into distributors.",
                ScriptDetectors::shareability, null)
        );
    }

    // ── hook_strength ──────────────────────────────────────────────────────

    public static DetectorOutcome hookStrength(ScriptText script, ScriptConstraints constraints) {
        ScriptLine first = script.first();
        if (first == null) {
            return new DetectorOutcome(0.0, List.of("script has no spoken lines"));
        }
        String hook = first.lower();
        List<String> evidence = new ArrayList<>();
        double score = 40.0;

        boolean curiosity = CURIOSITY.matcher(hook).find();
        boolean proof = PROOF.matcher(hook).find();
        boolean digit = DIGIT.matcher(hook).find();

        if (curiosity) {
            score += 15;
            evidence.add("curiosity trigger in the first line");
        }
        if (proof) {
            score += 15;
            evidence.add("proof signal in the first line");
        }
        if (!curiosity && !proof) {
            evidence.add("no curiosity or proof signal in the first line");
        }
        if (digit) {
            score += 8;
            evidence.add("specific number in the hook");
        }
        int words = first.wordCount();
        if (words >= 6 && words <= 16) {
            score += 7;
        } else if (words > 20) {
            score -= 10;
            evidence.add("hook runs " + words + " words, over 20");
        }
        if (FILLER_START.matcher(hook).find()) {
            score -= 15;
            evidence.add("hook opens with filler");
        }

        String hookStyle = constraints.hookStyle();
        if ("question".equals(hookStyle) && hook.contains("?")) {
            score += 5;
        } else if ("proof".equals(hookStyle) && proof) {
            score += 5;
        } else if (("number".equals(hookStyle) || "stat".equals(hookStyle)) && digit) {
            score += 5;
        }

        String tone = constraints.tone();
        if ("expert".equals(tone) && digit) {
            score += 3;
        } else if ("conversational".equals(tone) && SECOND_PERSON_WORD.matcher(hook).find()) {
            score += 5;
        }
        return new DetectorOutcome(score, evidence);
    }

    // ── time_to_value ──────────────────────────────────────────────────────

    public static DetectorOutcome timeToValue(ScriptText script, ScriptConstraints constraints) {
        int duration = constraints.durationSeconds();
        FormatType format = constraints.formatType();
        double target = PlatformProfile.of(constraints.platform()).valueTargetSeconds(format);

        List<String> evidence = new ArrayList<>();
        double seconds = -1;
        List<ScriptLine> lines = script.lines();
        for (int i = 0; i < lines.size() && seconds < 0; i++) {
            String line = lines.get(i).lower();
            for (Pattern signal : VALUE_SIGNALS) {
                if (signal.matcher(line).find()) {
                    seconds = script.startSeconds(i, duration);
                    evidence.add(String.format("payoff announced at ~%.1fs (line %d)",
                                               seconds, lines.get(i).lineNumber()));
                    break;
                }
            }
        }
        if (seconds < 0) {
            seconds = Math.min(duration * 0.25, 20.0);
            evidence.add("no explicit payoff statement");
        }
        double late = Math.max(0.0, seconds - target);
        if (late > 0) {
            evidence.add(String.format("payoff lands %.1fs after the %.0fs target", late, target));
        }
        return new DetectorOutcome(100.0 - late * 4.0, evidence);
    }

    // ── open_loops ─────────────────────────────────────────────────────────

    public static DetectorOutcome openLoops(ScriptText script, ScriptConstraints constraints) {
        Matcher matcher = OPEN_LOOP.matcher(script.lower());
        List<String> found = new ArrayList<>();
        while (matcher.find()) {
            found.add(matcher.group());
        }
        List<String> evidence = found.isEmpty()
            ? List.of("no open loop holds viewers to the end")
            : List.of(found.size() + " open loop(s), first: '" + found.get(0) + "'");
        return new DetectorOutcome(45.0 + 14.0 * found.size(), evidence);
    }

    // ── dead_zones ─────────────────────────────────────────────────────────

    public static DetectorOutcome deadZones(ScriptText script, ScriptConstraints constraints) {
        int duration = constraints.durationSeconds();
        double deadSeconds = 0.0;
        int count = 0;
        List<String> evidence = new ArrayList<>();
        for (int i = 0; i < script.size(); i++) {
            double seconds = script.lineSeconds(i, duration);
            if (isDeadZone(script.lines().get(i), seconds)) {
                deadSeconds += seconds;
                count++;
                evidence.add(String.format("line %d runs ~%.1fs without a new beat",
                                           script.lines().get(i).lineNumber(), seconds));
            }
        }
        if (count == 0) {
            evidence.add("no dead zones");
        }
        double score = 100.0 - deadSeconds / duration * 120.0 - count * 4.0;
        return new DetectorOutcome(score, evidence);
    }

    static boolean isDeadZone(ScriptLine line, double seconds) {
        return seconds >= DEAD_ZONE_SECONDS || line.wordCount() > DEAD_ZONE_WORDS;
    }

    // ── pattern_interrupts ─────────────────────────────────────────────────

    public static DetectorOutcome patternInterrupts(ScriptText script, ScriptConstraints constraints) {
        int duration = constraints.durationSeconds();
        String text = script.lower();

        int cues = 0;
        Matcher bracket = BRACKET_CUE.matcher(text);
        while (bracket.find()) {
            cues++;
        }
        Matcher spoken = SPOKEN_CUE.matcher(BRACKET_CUE.matcher(text).replaceAll(" "));
        while (spoken.find()) {
            cues++;
        }

        int interrupts = Math.max(0, script.size() - 1) + cues;
        double perMinute = interrupts / Math.max(duration / 60.0, 1.0);
        double target = interruptTarget(constraints);

        int longBeats = 0;
        for (int i = 0; i < script.size(); i++) {
            if (script.lineSeconds(i, duration) >= LONG_BEAT_SECONDS) {
                longBeats++;
            }
        }

        List<String> evidence = new ArrayList<>();
        evidence.add(String.format("%.1f interrupts per minute against a target of %.1f", perMinute, target));
        if (cues > 0) {
            evidence.add(cues + " explicit visual cue(s)");
        }
        if (longBeats > 0) {
            evidence.add(longBeats + " beat(s) of " + (int) LONG_BEAT_SECONDS + "s or longer");
        }
        return new DetectorOutcome(40.0 + perMinute / target * 60.0 - 6.0 * longBeats, evidence);
    }

    static double interruptTarget(ScriptConstraints constraints) {
        if ("high".equals(constraints.pacingDensity())) {
            return 6.0;
        }
        if ("low".equals(constraints.pacingDensity())) {
            return 3.0;
        }
        return PlatformProfile.of(constraints.platform()).interruptsPerMinute(constraints.formatType());
    }

    // ── cta_style ──────────────────────────────────────────────────────────

    public static DetectorOutcome ctaStyle(ScriptText script, ScriptConstraints constraints) {
        int window = Math.max(1, (int) Math.ceil(script.size() * 0.25));
        StringBuilder closing = new StringBuilder();
        for (ScriptLine line : script.lines().subList(Math.max(0, script.size() - window), script.size())) {
            closing.append(line.lower()).append('\n');
        }

        Map<String, Integer> hits = ctaHits(closing.toString());
        if (hits.isEmpty()) {
            return new DetectorOutcome(20.0, List.of("no call to action in the closing lines"));
        }

        String best = null;
        int bestHits = 0;
        for (Map.Entry<String, Integer> entry : hits.entrySet()) {
            if (entry.getValue() > bestHits) {
                best = entry.getKey();
                bestHits = entry.getValue();
            }
        }

        List<String> evidence = new ArrayList<>();
        evidence.add("closing CTA style: " + best);
        double score = 58.0 + 14.0 * bestHits;
        String wanted = constraints.ctaStyle();
        if (wanted != null) {
            if (wanted.equals(best)) {
                score += 6.0;
            } else {
                score -= 6.0;
                evidence.add("CTA does not match the requested " + wanted + " style");
            }
        }
        if (hits.size() > 1) {
            score -= 8.0;
            evidence.add("stacked CTAs: " + String.join(", ", hits.keySet()));
        }
        return new DetectorOutcome(score, evidence);
    }

    static Map<String, Integer> ctaHits(String text) {
        Map<String, Integer> hits = new LinkedHashMap<>();
        CTA_STYLES.forEach((style, patterns) -> {
            int count = 0;
            for (Pattern pattern : patterns) {
                if (pattern.matcher(text).find()) {
                    count++;
                }
            }
            if (count > 0) {
                hits.put(style, count);
            }
        });
        return hits;
    }

    // ── shareability ───────────────────────────────────────────────────────

    public static DetectorOutcome shareability(ScriptText script, ScriptConstraints constraints) {
        String text = script.lower();
        List<String> evidence = new ArrayList<>();
        double score = 40.0;

        int secondPerson = count(SECOND_PERSON, text);
        if (secondPerson > 0) {
            score += Math.min(15, 3 * secondPerson);
            evidence.add("direct address x" + secondPerson);
        }
        if (RELATABLE.matcher(text).find()) {
            score += 10;
            evidence.add("relatable framing");
        }
        if (LIST_STRUCTURE.matcher(text).find()) {
            score += 10;
            evidence.add("list structure");
        }
        if (SHARE_TRIGGER.matcher(text).find()) {
            score += 12;
            evidence.add("explicit share trigger");
        }
        if (CONTRAST.matcher(text).find()) {
            score += 8;
            evidence.add("contrast or myth-busting angle");
        }
        if (evidence.isEmpty()) {
            evidence.add("nothing prompts a viewer to pass this on");
        }
        return new DetectorOutcome(score, evidence);
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
