package com.scriptplatform.common.scoring;

import com.scriptplatform.common.model.ActualMetrics;
import com.scriptplatform.common.model.RetentionPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HistoricalChannelScorerTest {

    @Test
    @DisplayName("no views and no watch time → 0")
    void emptyMetrics() {
        assertEquals(0.0, HistoricalChannelScorer.actualScore(new ActualMetrics(0, 0, 0, 0, 0, 0.0), null));
    }

    @Test
    @DisplayName("components cap at reach 30, engagement 42, watch 18")
    void cappedComponents() {
        ActualMetrics metrics = new ActualMetrics(1_000_000, 50_000, 0, 0, 0, 35.0);
        // reach 30 (capped) + engagement 42 (capped) + watch 10
        assertEquals(82.0, HistoricalChannelScorer.actualScore(metrics, List.of()), 0.001);
    }

    @Test
    @DisplayName("retention curve adds up to 10 points")
    void retentionBonus() {
        ActualMetrics metrics = new ActualMetrics(1_000_000, 50_000, 0, 0, 0, 35.0);
        List<RetentionPoint> curve = List.of(new RetentionPoint(0, 100), new RetentionPoint(10, 100));
        assertEquals(92.0, HistoricalChannelScorer.actualScore(metrics, curve), 0.001);
    }

    @Test
    @DisplayName("fingerprint ignores line-ending style and outer whitespace")
    void fingerprintNormalisation() {
        assertEquals(ScriptFingerprint.of("a line\nnext line"), ScriptFingerprint.of("  a line\r\nnext line\n"));
        assertNotEquals(ScriptFingerprint.of("a line"), ScriptFingerprint.of("a line!"));
    }
}
