package com.scriptplatform.common.model;

/**
 * One point of a platform retention curve.
 *
 * @param time      seconds into the video
 * @param retention percentage of viewers still watching, 0–100
 */
public record RetentionPoint(
    double time,
    double retention
) {}
