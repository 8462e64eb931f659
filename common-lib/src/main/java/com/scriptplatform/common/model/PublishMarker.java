package com.scriptplatform.common.model;

import java.time.Instant;

/**
 * Advisory bookkeeping of which snapshot was published last for a platform. Carries no
 * enforcement: outcomes may target any snapshot at any time.
 */
public record PublishMarker(
    Long id,
    Platform platform,
    Long draftSnapshotId,
    Instant markedAt
) {}
