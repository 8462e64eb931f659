package com.scriptplatform.common.detector;

import com.scriptplatform.common.model.FormatType;
import com.scriptplatform.common.model.Platform;

/**
 * Pacing targets per platform. {@link #DEFAULT} is the neutral profile used for
 * unknown platforms.
 */
public enum PlatformProfile {
    //          value target (s)   interrupts / minute
    //          short   long       short   long
    YOUTUBE(    3.0,    8.0,       4.0,    2.0),
    INSTAGRAM(  3.0,    6.0,       4.5,    2.0),
    TIKTOK(     2.0,    6.0,       5.0,    2.5),
    DEFAULT(    3.0,    8.0,       4.0,    2.0);

    private final double valueTargetShort;
    private final double valueTargetLong;
    private final double interruptsShort;
    private final double interruptsLong;

    PlatformProfile(double valueTargetShort, double valueTargetLong,
                    double interruptsShort, double interruptsLong) {
        this.valueTargetShort = valueTargetShort;
        this.valueTargetLong = valueTargetLong;
        this.interruptsShort = interruptsShort;
        this.interruptsLong = interruptsLong;
    }

    public static PlatformProfile of(Platform platform) {
        if (platform == null) {
            return DEFAULT;
        }
        return switch (platform) {
            case YOUTUBE -> YOUTUBE;
            case INSTAGRAM -> INSTAGRAM;
            case TIKTOK -> TIKTOK;
            default -> DEFAULT;
        };
    }

    /** Seconds by which the payoff should be stated. */
    public double valueTargetSeconds(FormatType format) {
        return format == FormatType.SHORT_FORM ? valueTargetShort : valueTargetLong;
    }

    public double interruptsPerMinute(FormatType format) {
        return format == FormatType.SHORT_FORM ? interruptsShort : interruptsLong;
    }
}
