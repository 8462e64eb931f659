package com.scriptplatform.optimizer.controller;

import com.scriptplatform.common.model.RescoreResult;
import com.scriptplatform.common.model.VariantBatch;
import com.scriptplatform.optimizer.client.UserHeaders;
import com.scriptplatform.optimizer.dto.RescoreRequest;
import com.scriptplatform.optimizer.dto.VariantRequest;
import com.scriptplatform.optimizer.service.RescoreService;
import com.scriptplatform.optimizer.service.VariantGeneratorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/optimizer")
public class OptimizerController {

    private final VariantGeneratorService variantService;
    private final RescoreService rescoreService;

    public OptimizerController(VariantGeneratorService variantService, RescoreService rescoreService) {
        this.variantService = variantService;
        this.rescoreService = rescoreService;
    }

    @PostMapping("/variants")
    public Mono<ResponseEntity<VariantBatch>> generateVariants(
            @RequestBody VariantRequest request,
            @RequestHeader(value = UserHeaders.USER_ID, required = false) String userId) {
        return Mono.fromCallable(request::toBrief)
            .flatMap(brief -> variantService.generate(userId, brief))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/rescore")
    public Mono<ResponseEntity<RescoreResult>> rescore(
            @RequestBody RescoreRequest request,
            @RequestHeader(value = UserHeaders.USER_ID, required = false) String userId) {
        return Mono.defer(() -> rescoreService.rescore(userId, request))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
