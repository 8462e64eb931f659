package com.scriptplatform.common.scoring;

import com.scriptplatform.common.detector.DetectorSuite;
import com.scriptplatform.common.detector.ScriptText;
import com.scriptplatform.common.model.Channel;
import com.scriptplatform.common.model.ChannelContext;
import com.scriptplatform.common.model.DetectorResult;
import com.scriptplatform.common.model.ScoreBreakdown;
import com.scriptplatform.common.model.ScriptConstraints;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single scoring path shared by variant ranking and rescoring:
 * detector suite, channel scorers, then the signal combiner.
 */
public final class ScriptEvaluator {

    private final DetectorSuite suite;
    private final WeightPolicy weightPolicy;
    private final SignalCombiner combiner;

    public ScriptEvaluator(DetectorSuite suite, WeightPolicy weightPolicy, SignalCombiner combiner) {
        this.suite = suite;
        this.weightPolicy = weightPolicy;
        this.combiner = combiner;
    }

    public static ScriptEvaluator standard() {
        return new ScriptEvaluator(DetectorSuite.standard(), WeightPolicy.standard(), new SignalCombiner());
    }

    public DetectorSuite suite() {
        return suite;
    }

    public Evaluation evaluate(String scriptText, ScriptConstraints constraints,
                               ChannelContext context, Double baselineScore) {
        ScriptText script = ScriptText.parse(scriptText);
        ChannelContext channels = context == null ? ChannelContext.empty() : context;
        List<DetectorResult> rankings = suite.evaluate(script, constraints);

        double platform = ChannelScorers.platform(rankings, suite.registry());
        double competitor = ChannelScorers.competitor(platform, channels.benchmark());
        double historical = ChannelScorers.historical(platform, channels.historical());

        Map<String, Integer> samples = new LinkedHashMap<>();
        samples.put(Channel.PLATFORM.key(), ChannelScorers.platformSamples(rankings));
        samples.put(Channel.COMPETITOR.key(), channels.benchmark().sampleSize());
        samples.put(Channel.HISTORICAL.key(), channels.historical().sampleCount());

        ScoreBreakdown breakdown = combiner.combine(platform, competitor, historical, samples,
            weightPolicy.resolve(constraints.platform(), constraints.formatType()), baselineScore);
        return new Evaluation(script, rankings, breakdown);
    }
}
