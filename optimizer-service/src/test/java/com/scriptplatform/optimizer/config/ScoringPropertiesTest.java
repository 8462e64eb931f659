package com.scriptplatform.optimizer.config;

import com.scriptplatform.common.model.FormatType;
import com.scriptplatform.common.model.Platform;
import com.scriptplatform.common.scoring.ChannelWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringPropertiesTest {

    @Test
    @DisplayName("configured rows override the built-in weight table")
    void overrides() {
        ScoringProperties properties = new ScoringProperties();
        properties.setWeights(Map.of("instagram", new ScoringProperties.Weights(0.5, 0.3, 0.2)));

        assertEquals(new ChannelWeights(0.5, 0.3, 0.2),
            properties.toWeightPolicy().resolve(Platform.INSTAGRAM, FormatType.SHORT_FORM));
        assertEquals(new ChannelWeights(0.40, 0.40, 0.20),
            properties.toWeightPolicy().resolve(Platform.TIKTOK, FormatType.SHORT_FORM));
    }

    @Test
    @DisplayName("a row not summing to 1.0 fails fast")
    void invalidRow() {
        ScoringProperties properties = new ScoringProperties();
        properties.setWeights(Map.of("tiktok", new ScoringProperties.Weights(0.9, 0.9, 0.9)));
        assertThrows(IllegalArgumentException.class, properties::toWeightPolicy);
    }
}
