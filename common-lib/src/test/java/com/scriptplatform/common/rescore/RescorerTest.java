package com.scriptplatform.common.rescore;

import com.scriptplatform.common.exception.ValidationException;
import com.scriptplatform.common.model.ChannelContext;
import com.scriptplatform.common.model.DetectorDelta;
import com.scriptplatform.common.model.LineLevelEdit;
import com.scriptplatform.common.model.NextAction;
import com.scriptplatform.common.model.RescoreResult;
import com.scriptplatform.common.model.ScriptConstraints;
import com.scriptplatform.common.model.ScriptVariant;
import com.scriptplatform.common.scoring.ScriptEvaluator;
import com.scriptplatform.common.scoring.ScriptFingerprint;
import com.scriptplatform.common.variant.TemplateScriptGenerator;
import com.scriptplatform.common.variant.VariantBrief;
import com.scriptplatform.common.variant.VariantGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RescorerTest {

    private static final ScriptConstraints SHORTS_45 = ScriptConstraints.of("youtube_shorts", 45);

    private final ScriptEvaluator evaluator = ScriptEvaluator.standard();
    private final Rescorer rescorer = new Rescorer(evaluator);

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("blank text → ValidationException")
        void blank() {
            assertThrows(ValidationException.class,
                () -> rescorer.rescore("   ", SHORTS_45, null, null, ChannelContext.empty()));
        }

        @Test
        @DisplayName("text under 20 characters → ValidationException")
        void tooShort() {
            assertThrows(ValidationException.class,
                () -> rescorer.rescore("Too short.", SHORTS_45, null, null, ChannelContext.empty()));
        }
    }

    @Nested
    @DisplayName("edit loop")
    class EditLoop {

        @Test
        @DisplayName("removing the opening line of the top variant lowers the score and flags the hook")
        void removeOpeningLine() {
            VariantBrief brief = VariantBrief.of("3 hook mistakes", null, null, SHORTS_45, 3);
            List<ScriptVariant> variants = new VariantGenerator(evaluator)
                .rank("batch", brief, TemplateScriptGenerator.draftAll(brief), ChannelContext.empty());
            ScriptVariant top = variants.get(0);

            String[] lines = top.scriptText().split("\n");
            String edited = String.join("\n", Arrays.copyOfRange(lines, 1, lines.length));

            RescoreResult result = rescorer.rescore(edited, SHORTS_45,
                top.scoreBreakdown().combined(), top.detectorRankings(), ChannelContext.empty());

            assertNotNull(result.scoreBreakdown().deltaFromBaseline());
            assertTrue(result.scoreBreakdown().deltaFromBaseline() < 0);
            assertTrue(result.nextActions().stream().anyMatch(a -> a.detectorKey().equals("hook_strength")));
            assertEquals(ScriptFingerprint.of(edited), result.scriptFingerprint());

            assertEquals(result.scoreBreakdown().deltaFromBaseline(), result.improvementDiff().combinedDelta());
            DetectorDelta hook = result.improvementDiff().detectors().stream()
                .filter(d -> d.detectorKey().equals("hook_strength")).findFirst().orElseThrow();
            assertNotNull(hook.delta());
            assertTrue(hook.delta() < 0);
        }

        @Test
        @DisplayName("without a baseline the diff carries nulls, not zeros")
        void noBaseline() {
            RescoreResult result = rescorer.rescore("Here is the plan for your next video in three steps.",
                SHORTS_45, null, null, ChannelContext.empty());

            assertNull(result.scoreBreakdown().deltaFromBaseline());
            assertNull(result.improvementDiff().combinedBefore());
            assertNull(result.improvementDiff().combinedDelta());
            assertTrue(result.improvementDiff().detectors().stream().allMatch(d -> d.delta() == null));
        }
    }

    @Nested
    @DisplayName("next actions and line edits")
    class Planning {

        private static final String WEAK = String.join("\n",
            "So hi everyone, welcome back to the channel.",
            "",
            "Today we are going to chat about a few random things that happened this week.",
            "",
            "Thanks for watching.");

        @Test
        @DisplayName("actions ranked by gap descending, then priority; top 3 surfaced")
        void actionOrdering() {
            RescoreResult result = rescorer.rescore(WEAK, SHORTS_45, null, null, ChannelContext.empty());
            List<NextAction> actions = result.nextActions();

            assertFalse(actions.isEmpty());
            for (int i = 1; i < actions.size(); i++) {
                NextAction prev = actions.get(i - 1);
                NextAction next = actions.get(i);
                assertTrue(prev.thresholdGap() > next.thresholdGap()
                    || (prev.thresholdGap() == next.thresholdGap() && prev.priority() < next.priority()));
            }
            assertEquals(Math.min(3, actions.size()), result.topActions().size());
        }

        @Test
        @DisplayName("edits use raw 1-based line numbers and never guess for shareability")
        void lineEdits() {
            RescoreResult result = rescorer.rescore(WEAK, SHORTS_45, null, null, ChannelContext.empty());
            List<LineLevelEdit> edits = result.lineLevelEdits();

            assertTrue(edits.stream().anyMatch(e -> e.detectorKey().equals("hook_strength") && e.lineNumber() == 1));
            assertTrue(edits.stream().anyMatch(e -> e.detectorKey().equals("cta_style") && e.lineNumber() == 5));
            assertTrue(edits.stream().noneMatch(e -> e.detectorKey().equals("shareability")));
            assertEquals("Thanks for watching.", edits.stream()
                .filter(e -> e.detectorKey().equals("cta_style")).findFirst().orElseThrow().originalLine());
        }

        @Test
        @DisplayName("a single-paragraph script gets actions but no sentence-level edits on its only line")
        void paragraphScript() {
            String paragraph = "So today we talk about editing. There are many things to say about it and we "
                + "will go through them slowly. It matters a lot. Anyway that is about it.";

            RescoreResult result = rescorer.rescore(paragraph, SHORTS_45, null, null, ChannelContext.empty());

            assertTrue(result.nextActions().stream().anyMatch(a -> a.detectorKey().equals("cta_style")));
            assertTrue(result.lineLevelEdits().isEmpty());
        }

        @Test
        @DisplayName("detectors at or above threshold emit no edit")
        void onlyFailingDetectors() {
            RescoreResult result = rescorer.rescore(WEAK, SHORTS_45, null, null, ChannelContext.empty());
            for (LineLevelEdit edit : result.lineLevelEdits()) {
                assertTrue(result.nextActions().stream().anyMatch(a -> a.detectorKey().equals(edit.detectorKey())),
                    edit.detectorKey());
            }
        }
    }
}
