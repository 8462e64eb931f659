package com.scriptplatform.common.scoring;

import com.scriptplatform.common.model.ActualMetrics;
import com.scriptplatform.common.model.RetentionPoint;
import com.scriptplatform.common.model.Scores;

import java.util.List;

/**
 * Scores measured performance on the same 0–100 scale as predictions.
 *
 * <p>Components:
 * <ul>
 *   <li>reach: log-scaled views, up to 30</li>
 *   <li>engagement: weighted interactions per view, up to 42</li>
 *   <li>watch depth: average view duration, up to 18</li>
 *   <li>retention: mean of the retention curve, up to 10 (0 when no curve)</li>
 * </ul>
 */
public final class HistoricalChannelScorer {

    private HistoricalChannelScorer() {}

    public static double actualScore(ActualMetrics metrics, List<RetentionPoint> retentionPoints) {
        double views = Math.max(0, metrics.views());
        double reach = Math.min(30.0, Math.log10(views + 1.0) * 7.5);

        double interactions = Math.max(0, metrics.likes())
            + Math.max(0, metrics.comments()) * 2.0
            + Math.max(0, metrics.shares()) * 3.0
            + Math.max(0, metrics.saves()) * 3.0;
        double engagement = Math.min(42.0, interactions / Math.max(views, 1.0) * 900.0);

        double watch = Math.min(18.0, Math.max(0.0, metrics.avgViewDurationS()) / 3.5);

        double retention = 0.0;
        if (retentionPoints != null && !retentionPoints.isEmpty()) {
            double mean = retentionPoints.stream()
                .mapToDouble(p -> Scores.clamp(p.retention()))
                .average()
                .orElse(0.0);
            retention = Math.min(10.0, mean * 0.12);
        }
        return Scores.round1(Scores.clamp(reach + engagement + watch + retention));
    }
}
