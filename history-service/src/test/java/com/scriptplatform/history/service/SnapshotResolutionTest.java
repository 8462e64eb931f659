package com.scriptplatform.history.service;

import com.scriptplatform.common.calibration.CalibrationThresholds;
import com.scriptplatform.common.exception.StoreUnavailableException;
import com.scriptplatform.common.model.DraftSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;

import static com.scriptplatform.history.service.DraftFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SnapshotResolutionTest {

    @Test
    @DisplayName("store failure while resolving the snapshot → StoreUnavailableException")
    void lookupFailure() {
        SnapshotService failingStore = new SnapshotService(null, null, null, Clock.systemUTC()) {
            @Override
            public Mono<DraftSnapshot> get(String userId, Long id) {
                return Mono.error(new IllegalStateException("connection refused"));
            }
        };
        OutcomeCalibrationService service = new OutcomeCalibrationService(
            null, failingStore, null, CalibrationThresholds.DEFAULT, Clock.systemUTC());

        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
            () -> service.ingest(newUser(), outcome(7L, STRONG_METRICS, null, null)).block());
        assertEquals("ingest_outcome", e.getOperation());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
