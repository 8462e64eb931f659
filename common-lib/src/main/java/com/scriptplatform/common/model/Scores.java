package com.scriptplatform.common.model;

/**
 * Rounding and clamping helpers shared by every scoring path.
 */
public final class Scores {

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;
    public static final double NEUTRAL = 50.0;

    private Scores() {}

    public static double clamp(double value) {
        return clamp(value, MIN, MAX);
    }

    public static double clamp(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
