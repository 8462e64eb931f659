package com.scriptplatform.history.controller;

import com.scriptplatform.common.exception.ResourceNotFoundException;
import com.scriptplatform.common.model.DraftSnapshot;
import com.scriptplatform.common.model.PublishMarker;
import com.scriptplatform.common.model.SnapshotInput;
import com.scriptplatform.history.service.SnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/snapshots")
public class SnapshotController {

    private static final Logger log = LoggerFactory.getLogger(SnapshotController.class);

    private final SnapshotService snapshotService;

    public SnapshotController(SnapshotService snapshotService) {
        this.snapshotService = snapshotService;
    }

    @PostMapping
    public Mono<ResponseEntity<DraftSnapshot>> save(
            @RequestBody SnapshotInput input,
            @RequestHeader(value = UserHeaders.USER_ID, defaultValue = UserHeaders.ANONYMOUS) String userId) {
        log.info("Snapshot save received. platform={} variantId={}", input.platform(), input.variantId());
        return snapshotService.save(userId, input)
            .map(ResponseEntity::ok);
    }

    @GetMapping
    public Flux<DraftSnapshot> list(
            @RequestParam(defaultValue = "youtube") String platform,
            @RequestParam(required = false) Integer limit,
            @RequestHeader(value = UserHeaders.USER_ID, defaultValue = UserHeaders.ANONYMOUS) String userId) {
        return snapshotService.list(userId, platform, limit);
    }

    @GetMapping("/published")
    public Mono<ResponseEntity<PublishMarker>> published(
            @RequestParam(defaultValue = "youtube") String platform,
            @RequestHeader(value = UserHeaders.USER_ID, defaultValue = UserHeaders.ANONYMOUS) String userId) {
        return snapshotService.published(userId, platform)
            .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("published_snapshot",
                "no snapshot marked published. platform=" + platform)))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<DraftSnapshot>> get(
            @PathVariable Long id,
            @RequestHeader(value = UserHeaders.USER_ID, defaultValue = UserHeaders.ANONYMOUS) String userId) {
        return snapshotService.get(userId, id)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/publish")
    public Mono<ResponseEntity<PublishMarker>> markPublished(
            @PathVariable Long id,
            @RequestHeader(value = UserHeaders.USER_ID, defaultValue = UserHeaders.ANONYMOUS) String userId) {
        log.info("Publish marker requested. snapshotId={}", id);
        return snapshotService.markPublished(userId, id)
            .map(ResponseEntity::ok);
    }
}
