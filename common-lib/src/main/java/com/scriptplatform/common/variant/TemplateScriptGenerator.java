package com.scriptplatform.common.variant;

import com.scriptplatform.common.model.Platform;
import com.scriptplatform.common.model.ScriptConstraints;
import com.scriptplatform.common.model.ScriptDraft;
import com.scriptplatform.common.model.VariantSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic fallback generator: one fixed template per {@link VariantStyle}.
 * Same brief, same text.
 */
public final class TemplateScriptGenerator {

    private TemplateScriptGenerator() {}

    public static List<ScriptDraft> draftAll(VariantBrief brief) {
        List<ScriptDraft> drafts = new ArrayList<>();
        for (VariantStyle style : VariantStyle.first(brief.count())) {
            drafts.add(draft(style, brief));
        }
        return drafts;
    }

    public static ScriptDraft draft(VariantStyle style, VariantBrief brief) {
        ScriptConstraints constraints = brief.constraints();
        String prefix = tonePrefix(constraints.tone());
        String topic = brief.topic();
        String audience = brief.audience();
        String objective = brief.objective();
        String cta = platformCta(constraints.platform());

        List<String> lines = switch (style) {
            case OUTCOME_PROOF -> List.of(
                prefix + " I used this " + topic + " play and saw measurable lift.",
                "In " + constraints.durationSeconds() + " seconds, I will show the 3-step framework for " + audience + ".",
                "Step 1: Lead with outcome + proof in the first sentence.",
                "Step 2: Cut dead space and add a pattern interrupt before every likely drop.",
                "Step 3: Close with one CTA tied to " + objective + ".",
                cta);
            case CURIOSITY_GAP -> List.of(
                "Most creators miss this " + topic + " signal and lose reach in the first 3 seconds.",
                "Stay to the end because I will show the exact fix and where to place it.",
                "Open loop: call out the hidden mistake before giving the fix.",
                "Deliver one concrete proof point and one copyable line.",
                "Then use a single CTA that supports " + objective + ".",
                cta);
            case CONTRARIAN -> List.of(
                "Stop copying viral formats blindly; your " + topic + " strategy needs this switch.",
                "Contrarian claim: shorter setup, earlier payoff, and fewer CTA asks outperform more editing tricks.",
                "For " + audience + ", run this sequence: claim -> proof -> 2 steps -> CTA.",
                "Use one strong visual interrupt where most viewers drop.",
                "Measure success by " + objective + ", not by vanity spikes.",
                cta);
            case COUNTDOWN -> List.of(
                prefix + " here are 3 " + topic + " fixes most creators never test.",
                "Number one is the one nobody talks about, so stick around.",
                "3. Cut the intro and open on the result.",
                "2. Change the visual every few seconds so the scroll never wins.",
                "1. Say the payoff before anything else, then prove it.",
                cta);
            case STORY_ARC -> List.of(
                prefix + " last month my " + topic + " videos stalled at the same drop-off point.",
                "I tested one change for " + audience + " and the retention graph flipped.",
                "Here is what I changed: the payoff moved into the first line.",
                "Then every line got a single job and a visual cue.",
                "The result: " + objective + " within two weeks.",
                cta);
        };
        return new ScriptDraft(style.key(), style.label(), String.join("\n", lines),
                               style.rationale(), VariantSource.FALLBACK);
    }

    static String tonePrefix(String tone) {
        if (tone == null) {
            return "Quick take:";
        }
        return switch (tone) {
            case "bold" -> "Straight truth:";
            case "expert" -> "Data-backed insight:";
            default -> "Quick take:";
        };
    }

    static String platformCta(Platform platform) {
        return switch (platform) {
            case YOUTUBE -> "Comment 'PLAN' and I will post the exact template.";
            case INSTAGRAM -> "Save this and send it to one creator who needs it.";
            case TIKTOK -> "Follow for part two and comment your niche.";
            default -> "Comment if you want the template.";
        };
    }
}
