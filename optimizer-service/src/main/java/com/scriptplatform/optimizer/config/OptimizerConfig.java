package com.scriptplatform.optimizer.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scriptplatform.common.detector.DetectorRegistry;
import com.scriptplatform.common.detector.DetectorSuite;
import com.scriptplatform.common.rescore.Rescorer;
import com.scriptplatform.common.scoring.ScriptEvaluator;
import com.scriptplatform.common.scoring.SignalCombiner;
import com.scriptplatform.common.variant.VariantGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class OptimizerConfig {

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Value("${services.competitor.base-url:}")
    private String competitorUrl;

    @Bean
    public WebClient historyClient(WebClient.Builder builder) {
        return builder.baseUrl(historyUrl).build();
    }

    @Bean
    public WebClient competitorClient(WebClient.Builder builder) {
        return competitorUrl.isBlank() ? builder.build() : builder.baseUrl(competitorUrl).build();
    }

    @Bean
    public DetectorSuite detectorSuite(ScoringProperties properties) {
        return new DetectorSuite(DetectorRegistry.standard().withActionThresholds(properties.getActionThresholds()));
    }

    @Bean
    public ScriptEvaluator scriptEvaluator(DetectorSuite detectorSuite, ScoringProperties properties) {
        return new ScriptEvaluator(detectorSuite, properties.toWeightPolicy(),
                                   new SignalCombiner(properties.toConfidencePolicy()));
    }

    @Bean
    public Rescorer rescorer(ScriptEvaluator scriptEvaluator) {
        return new Rescorer(scriptEvaluator);
    }

    @Bean
    public VariantGenerator variantGenerator(ScriptEvaluator scriptEvaluator) {
        return new VariantGenerator(scriptEvaluator);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
