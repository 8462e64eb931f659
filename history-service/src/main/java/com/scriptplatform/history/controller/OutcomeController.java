package com.scriptplatform.history.controller;

import com.scriptplatform.common.model.CalibrationSummary;
import com.scriptplatform.common.model.OutcomeInput;
import com.scriptplatform.common.model.OutcomeRecord;
import com.scriptplatform.history.service.OutcomeCalibrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1")
public class OutcomeController {

    private static final Logger log = LoggerFactory.getLogger(OutcomeController.class);

    private final OutcomeCalibrationService calibrationService;

    public OutcomeController(OutcomeCalibrationService calibrationService) {
        this.calibrationService = calibrationService;
    }

    @PostMapping("/outcomes")
    public Mono<ResponseEntity<OutcomeRecord>> ingest(
            @RequestBody OutcomeInput input,
            @RequestHeader(value = UserHeaders.USER_ID, defaultValue = UserHeaders.ANONYMOUS) String userId) {
        log.info("Outcome received. snapshotId={} platform={} label={}",
                 input.draftSnapshotId(), input.platform(), input.measurementLabel());
        return calibrationService.ingest(userId, input)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/calibration/summary")
    public Mono<ResponseEntity<CalibrationSummary>> summary(
            @RequestParam(defaultValue = "youtube") String platform,
            @RequestHeader(value = UserHeaders.USER_ID, defaultValue = UserHeaders.ANONYMOUS) String userId) {
        return calibrationService.summarize(userId, platform)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
