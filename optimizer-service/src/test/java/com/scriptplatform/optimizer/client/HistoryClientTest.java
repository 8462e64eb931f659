package com.scriptplatform.optimizer.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptplatform.common.model.HistoricalBaseline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HistoryClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("d30 window becomes the historical baseline")
    void readsD30() throws Exception {
        HistoricalBaseline baseline = HistoryClient.toBaseline(mapper.readTree(
            "{\"drift_windows\": {\"d30\": {\"count\": 4, \"mean_delta\": -6.5, \"mean_actual_score\": 41.2}}}"));

        assertEquals(4, baseline.sampleCount());
        assertEquals(-6.5, baseline.meanDelta(), 1e-9);
        assertEquals(41.2, baseline.meanActualScore(), 1e-9);
    }

    @Test
    @DisplayName("empty window → empty baseline")
    void emptyWindow() throws Exception {
        assertEquals(HistoricalBaseline.empty(), HistoryClient.toBaseline(mapper.readTree("{}")));
    }

    @Test
    @DisplayName("missing benchmark fields fall back to the default difficulty")
    void benchmarkDefaults() throws Exception {
        assertEquals(55.0, CompetitorBenchmarkClient.toBenchmark(mapper.readTree("{\"sample_size\": 3}"))
            .difficultyScore(), 1e-9);
    }
}
