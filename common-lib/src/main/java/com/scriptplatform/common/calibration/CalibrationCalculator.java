package com.scriptplatform.common.calibration;

import com.scriptplatform.common.model.Bias;
import com.scriptplatform.common.model.CalibrationSummary;
import com.scriptplatform.common.model.Confidence;
import com.scriptplatform.common.model.DriftWindow;
import com.scriptplatform.common.model.OutcomeRecord;
import com.scriptplatform.common.model.Platform;
import com.scriptplatform.common.model.Scores;
import com.scriptplatform.common.model.Trend;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pure drift and bias computation over a (user, platform) outcome set.
 *
 * <p>Rules:
 * <ul>
 *   <li>window {@code dN}: outcomes with {@code posted_at >= now - N days}</li>
 *   <li>bias: {@code under_prediction} when mean delta &gt; τ, {@code over_prediction} when &lt; −τ</li>
 *   <li>confidence: {@code high} at d30 count ≥ K_high, {@code low} at zero, else {@code medium}</li>
 *   <li>trend: d7 MAE against d30 MAE, outside the margin either way</li>
 * </ul>
 *
 * <p>No reactive types. No logging. No side effects.
 */
public final class CalibrationCalculator {

    public static final int SHORT_WINDOW_DAYS = 7;
    public static final int LONG_WINDOW_DAYS = 30;
    static final int MAX_ACTIONS = 4;

    private CalibrationCalculator() {}

    public static CalibrationSummary summarize(Platform platform,
                                               List<OutcomeRecord> outcomes,
                                               Instant now,
                                               CalibrationThresholds thresholds) {
        List<OutcomeRecord> ordered = new ArrayList<>(outcomes == null ? List.of() : outcomes);
        ordered.sort(Comparator.comparing(OutcomeRecord::postedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(OutcomeRecord::id, Comparator.nullsLast(Comparator.reverseOrder())));

        DriftWindow d7 = window(ordered, SHORT_WINDOW_DAYS, now, thresholds);
        DriftWindow d30 = window(ordered, LONG_WINDOW_DAYS, now, thresholds);

        Map<String, DriftWindow> windows = new LinkedHashMap<>();
        windows.put(CalibrationSummary.WINDOW_7D, d7);
        windows.put(CalibrationSummary.WINDOW_30D, d30);

        int sampleSize = ordered.size();
        boolean insufficient = sampleSize < thresholds.minimumSamples();

        return new CalibrationSummary(
            platform,
            confidence(d30, thresholds),
            trend(d7, d30, thresholds),
            windows,
            sampleSize,
            hitRate(ordered, thresholds),
            insufficient,
            nextActions(platform, d7, d30, insufficient),
            ordered.subList(0, Math.min(thresholds.recentLimit(), ordered.size())));
    }

    static DriftWindow window(List<OutcomeRecord> outcomes, int days, Instant now, CalibrationThresholds thresholds) {
        Instant cutoff = now.minus(Duration.ofDays(days));
        int count = 0;
        double deltaSum = 0.0;
        double absSum = 0.0;
        double actualSum = 0.0;
        for (OutcomeRecord outcome : outcomes) {
            if (outcome.postedAt() == null || outcome.postedAt().isBefore(cutoff)) {
                continue;
            }
            count++;
            deltaSum += outcome.calibrationDelta();
            absSum += Math.abs(outcome.calibrationDelta());
            actualSum += outcome.actualScore();
        }
        if (count == 0) {
            return DriftWindow.empty(days);
        }
        double meanDelta = deltaSum / count;
        return new DriftWindow(days, count, Scores.round2(meanDelta), Scores.round2(absSum / count),
                               Scores.round2(actualSum / count), bias(meanDelta, thresholds.biasTolerance()));
    }

    static Bias bias(double meanDelta, double tolerance) {
        if (meanDelta > tolerance) {
            return Bias.UNDER_PREDICTION;
        }
        if (meanDelta < -tolerance) {
            return Bias.OVER_PREDICTION;
        }
        return Bias.NEUTRAL;
    }

    static Confidence confidence(DriftWindow d30, CalibrationThresholds thresholds) {
        if (d30.count() == 0) {
            return Confidence.LOW;
        }
        return d30.count() >= thresholds.highConfidenceCount() ? Confidence.HIGH : Confidence.MEDIUM;
    }

    static Trend trend(DriftWindow d7, DriftWindow d30, CalibrationThresholds thresholds) {
        if (d7.count() == 0 || d30.count() == 0) {
            return Trend.FLAT;
        }
        double difference = d7.meanAbsError() - d30.meanAbsError();
        if (difference < -thresholds.trendMargin()) {
            return Trend.IMPROVING;
        }
        if (difference > thresholds.trendMargin()) {
            return Trend.WORSENING;
        }
        return Trend.FLAT;
    }

    static double hitRate(List<OutcomeRecord> outcomes, CalibrationThresholds thresholds) {
        if (outcomes.isEmpty()) {
            return 0.0;
        }
        long hits = outcomes.stream()
            .filter(o -> Math.abs(o.calibrationDelta()) <= thresholds.hitTolerance())
            .count();
        return Scores.round2((double) hits / outcomes.size());
    }

    static List<String> nextActions(Platform platform, DriftWindow d7, DriftWindow d30, boolean insufficient) {
        Set<String> actions = new LinkedHashSet<>();
        if (insufficient) {
            actions.add("Capture at least 5 " + capitalize(platform.key())
                + " post outcomes to improve confidence.");
        }

        DriftWindow primary = d7.bias() != Bias.NEUTRAL ? d7 : d30;
        if (primary.bias() == Bias.UNDER_PREDICTION) {
            actions.add("Actuals are running above predictions. Raise targets and increase weight on the "
                + "competitor_metrics channel.");
        } else if (primary.bias() == Bias.OVER_PREDICTION) {
            actions.add("Actuals are running below predictions. Tighten hooks and cut dead zones before "
                + "posting, and reduce weight on the platform_metrics channel.");
        }

        if (d30.count() > 0) {
            if (d30.meanAbsError() > 16) {
                actions.add("Re-score every edited draft and execute the top 2 detector actions before publishing.");
            } else if (d30.meanAbsError() > 10) {
                actions.add("Use A/B script variants and keep only drafts with positive re-score deltas.");
            } else {
                actions.add("Calibration is healthy. Scale the current format and topic mix.");
            }
        }

        if (d7.bias() != Bias.NEUTRAL && d30.bias() != Bias.NEUTRAL && d7.bias() != d30.bias()) {
            actions.add("7d vs 30d drift differs. Re-check posting cadence and topic consistency.");
        }
        return new ArrayList<>(actions).subList(0, Math.min(MAX_ACTIONS, actions.size()));
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }
}
