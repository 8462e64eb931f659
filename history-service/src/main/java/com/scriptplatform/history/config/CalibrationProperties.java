package com.scriptplatform.history.config;

import com.scriptplatform.common.calibration.CalibrationThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Calibration tunables bound from {@code calibration.*}. Defaults match
 * {@link CalibrationThresholds#DEFAULT}.
 */
@Data
@ConfigurationProperties(prefix = "calibration")
public class CalibrationProperties {

    private double biasTolerance = 3.0;
    private int highConfidenceCount = 20;
    private double trendMargin = 1.5;
    private double hitTolerance = 10.0;
    private int recentLimit = 12;
    private int minimumSamples = 5;

    public CalibrationThresholds toThresholds() {
        return new CalibrationThresholds(biasTolerance, highConfidenceCount, trendMargin,
                                         hitTolerance, recentLimit, minimumSamples);
    }
}
