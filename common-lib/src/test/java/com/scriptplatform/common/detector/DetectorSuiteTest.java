package com.scriptplatform.common.detector;

import com.scriptplatform.common.model.DetectorResult;
import com.scriptplatform.common.model.ScriptConstraints;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DetectorSuiteTest {

    private static final String STRONG_SCRIPT = String.join("\n",
        "Straight truth: I used this 3 hook mistakes play and saw measurable lift.",
        "In 45 seconds, I will show the 3-step framework for solo creators.",
        "Step 1: Lead with outcome + proof in the first sentence.",
        "Step 2: Cut dead space and add a pattern interrupt before every likely drop.",
        "Step 3: Close with one CTA tied to higher retention and shares.",
        "Comment 'PLAN' and I will post the exact template.");

    private static final ScriptConstraints YOUTUBE_45 = ScriptConstraints.of("youtube_shorts", 45);

    // ── ordering ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluate() ordering")
    class Ordering {

        @Test
        @DisplayName("returns one result per standard detector")
        void allDetectorsReported() {
            List<DetectorResult> results = DetectorSuite.standard().evaluate(STRONG_SCRIPT, YOUTUBE_45);
            assertEquals(7, results.size());
            assertEquals(7, results.stream().map(DetectorResult::detectorKey).distinct().count());
        }

        @Test
        @DisplayName("sorted by score descending, ties by priority")
        void scoreThenPriority() {
            DetectorSuite suite = DetectorSuite.standard();
            List<DetectorResult> results = suite.evaluate(STRONG_SCRIPT, YOUTUBE_45);
            for (int i = 1; i < results.size(); i++) {
                DetectorResult prev = results.get(i - 1);
                DetectorResult next = results.get(i);
                assertTrue(prev.score() >= next.score());
                if (prev.score() == next.score()) {
                    int prevPriority = suite.registry().find(prev.detectorKey()).orElseThrow().priority();
                    int nextPriority = suite.registry().find(next.detectorKey()).orElseThrow().priority();
                    assertTrue(prevPriority < nextPriority);
                }
            }
        }

        @Test
        @DisplayName("every score stays within [0, 100]")
        void scoresClamped() {
            String runOn = "so " + "this keeps going without a break and ".repeat(30);
            for (DetectorResult result : DetectorSuite.standard().evaluate(runOn, YOUTUBE_45)) {
                assertTrue(result.score() >= 0.0 && result.score() <= 100.0, result.detectorKey());
            }
        }
    }

    // ── failure isolation ──────────────────────────────────────────────────

    @Nested
    @DisplayName("failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("throwing detector → floor score, failed flag, others still run")
        void throwingDetectorUsesFloor() {
            DetectorDefinition broken = new DetectorDefinition("broken", "Broken", 8, 0.0, 12.0, 50.0,
                "t", "w", (script, constraints) -> { throw new IllegalStateException("boom"); }, null);
            DetectorSuite suite = new DetectorSuite(DetectorRegistry.standard().plus(broken));

            List<DetectorResult> results = suite.evaluate(STRONG_SCRIPT, YOUTUBE_45);

            assertEquals(8, results.size());
            DetectorResult failed = results.stream()
                .filter(r -> r.detectorKey().equals("broken")).findFirst().orElseThrow();
            assertTrue(failed.failed());
            assertEquals(12.0, failed.score());
            assertFalse(failed.evidence().isEmpty());
            assertEquals(7, results.stream().filter(r -> !r.failed()).count());
        }

        @Test
        @DisplayName("duplicate keys are rejected at registry construction")
        void duplicateKeysRejected() {
            List<DetectorDefinition> twice = List.of(
                ScriptDetectors.standardDefinitions().get(0), ScriptDetectors.standardDefinitions().get(0));
            assertThrows(IllegalArgumentException.class, () -> DetectorRegistry.of(twice));
        }
    }

    // ── constraints ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("constraints")
    class Constraints {

        @Test
        @DisplayName("unknown platform and tone use the neutral profile")
        void unknownPlatformIsNeutral() {
            ScriptConstraints unknown = ScriptConstraints.of("myspace", 45, "whimsical", null, null, null);
            List<DetectorResult> results = DetectorSuite.standard().evaluate(STRONG_SCRIPT, unknown);

            assertEquals(7, results.size());
            assertTrue(results.stream().noneMatch(DetectorResult::failed));
            assertEquals(PlatformProfile.DEFAULT, PlatformProfile.of(unknown.platform()));
        }

        @Test
        @DisplayName("matching CTA style constraint scores higher than a mismatched one")
        void ctaStyleConstraint() {
            ScriptText script = ScriptText.parse(STRONG_SCRIPT);
            double matched = ScriptDetectors.ctaStyle(script,
                ScriptConstraints.of("youtube", 45, null, null, "comment_prompt", null)).score();
            double mismatched = ScriptDetectors.ctaStyle(script,
                ScriptConstraints.of("youtube", 45, null, null, "link_bio", null)).score();
            assertTrue(matched > mismatched);
        }
    }

    // ── individual detectors ───────────────────────────────────────────────

    @Nested
    @DisplayName("individual detectors")
    class Individual {

        @Test
        @DisplayName("curiosity + proof + number hook clears the hook threshold")
        void strongHook() {
            DetectorOutcome outcome = ScriptDetectors.hookStrength(ScriptText.parse(STRONG_SCRIPT), YOUTUBE_45);
            assertEquals(85.0, outcome.score(), 0.001);
        }

        @Test
        @DisplayName("filler opener without signal scores low")
        void fillerHook() {
            DetectorOutcome outcome = ScriptDetectors.hookStrength(
                ScriptText.parse("So today I want to talk about my week."), YOUTUBE_45);
            assertTrue(outcome.score() < 65.0);
            assertTrue(outcome.evidence().contains("no curiosity or proof signal in the first line"));
        }

        @Test
        @DisplayName("open loops add 14 points each")
        void openLoops() {
            ScriptText none = ScriptText.parse("Here is the plan for today and nothing else.");
            ScriptText two = ScriptText.parse("Stick around, because by the end it all clicks.");
            assertEquals(45.0, ScriptDetectors.openLoops(none, YOUTUBE_45).score(), 0.001);
            assertEquals(73.0, ScriptDetectors.openLoops(two, YOUTUBE_45).score(), 0.001);
        }

        @Test
        @DisplayName("no closing CTA scores the floor of 20")
        void missingCta() {
            ScriptText script = ScriptText.parse("Line one of the script.\nThanks for watching.");
            assertEquals(20.0, ScriptDetectors.ctaStyle(script, YOUTUBE_45).score(), 0.001);
        }

        @Test
        @DisplayName("single long line is a dead zone")
        void deadZone() {
            ScriptText script = ScriptText.parse("one two three four five");
            assertTrue(ScriptDetectors.deadZones(script, YOUTUBE_45).score() < 60.0);
        }
    }

    // ── parsing ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ScriptText parsing")
    class Parsing {

        @Test
        @DisplayName("blank lines are skipped but keep raw numbering")
        void rawLineNumbers() {
            ScriptText script = ScriptText.parse("First line here.\n\nThird line here.\r\nFourth.");
            assertEquals(3, script.size());
            assertEquals(List.of(1, 3, 4),
                script.lines().stream().map(ScriptLine::lineNumber).toList());
        }

        @Test
        @DisplayName("single paragraph splits into sentences on line 1")
        void sentenceSplit() {
            ScriptText script = ScriptText.parse("First beat. Second beat! Third beat?");
            assertEquals(3, script.size());
            assertTrue(script.lines().stream().allMatch(line -> line.lineNumber() == 1));
            assertEquals(3, script.unitsOnLine(1));
            assertEquals(1, ScriptText.parse("One line.\nTwo lines.").unitsOnLine(2));
        }

        @Test
        @DisplayName("spoken time is apportioned by word count")
        void timing() {
            ScriptText script = ScriptText.parse("one two three\nfour five six seven eight nine");
            assertEquals(0.0, script.startSeconds(0, 45), 0.001);
            assertEquals(15.0, script.startSeconds(1, 45), 0.001);
            assertEquals(30.0, script.lineSeconds(1, 45), 0.001);
        }
    }
}
