package com.scriptplatform.optimizer.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scriptplatform.common.exception.GenerationBackendUnavailableException;
import com.scriptplatform.common.model.ScriptConstraints;
import com.scriptplatform.common.model.ScriptDraft;
import com.scriptplatform.common.model.VariantSource;
import com.scriptplatform.common.rescore.Rescorer;
import com.scriptplatform.common.variant.VariantStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Calls {@code POST {generation.backend.base-url}/v1/scripts}.
 *
 * <p>Request body: topic, audience, objective, platform, duration, tone and one
 * {@code {style_key, label, instruction}} entry per requested style. Response body:
 * {@code {"variants": [{"style_key", "script_text", "rationale"}]}}. Entries with an
 * unknown style or too little text are dropped; the caller fills the gap from templates.
 *
 * <p>When no base URL is configured every call signals
 * {@link GenerationBackendUnavailableException} without touching the network.
 */
@Component
public class HttpGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpGenerationBackend.class);

    private final WebClient generationClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public HttpGenerationBackend(WebClient.Builder builder,
                                 ObjectMapper objectMapper,
                                 @Value("${generation.backend.base-url:}") String baseUrl,
                                 @Value("${generation.backend.api-key:}") String apiKey,
                                 @Value("${generation.backend.model:script-writer-v1}") String model) {
        this.baseUrl = baseUrl == null ? "" : baseUrl.trim();
        this.generationClient = this.baseUrl.isEmpty()
            ? builder.build()
            : builder.baseUrl(this.baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public Mono<List<ScriptDraft>> generate(GenerationRequest request) {
        if (baseUrl.isEmpty()) {
            return Mono.error(new GenerationBackendUnavailableException("generation backend not configured"));
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(request)))
            .flatMap(bodyJson -> generationClient.post()
                .uri("/v1/scripts")
                .headers(headers -> {
                    if (apiKey != null && !apiKey.isBlank()) {
                        headers.setBearerAuth(apiKey);
                    }
                })
                .bodyValue(bodyJson)
                .retrieve()
                .bodyToMono(String.class))
            .map(this::parseDrafts)
            .doOnSuccess(drafts -> log.info("Generation backend returned drafts. count={} model={}",
                                            drafts.size(), model));
    }

    @Override
    public String provider() {
        return "http";
    }

    @Override
    public String model() {
        return model;
    }

    private Map<String, Object> requestBody(GenerationRequest request) {
        ScriptConstraints constraints = request.brief().constraints();
        List<Map<String, String>> styles = new ArrayList<>();
        for (VariantStyle style : request.styles()) {
            styles.add(Map.of(
                "style_key", style.key(),
                "label", style.label(),
                "instruction", style.instruction()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("topic", request.brief().topic());
        body.put("audience", request.brief().audience());
        body.put("objective", request.brief().objective());
        body.put("platform", constraints.platform().key());
        body.put("duration_seconds", constraints.durationSeconds());
        body.put("tone", constraints.tone());
        body.put("styles", styles);
        return body;
    }

    List<ScriptDraft> parseDrafts(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new GenerationBackendUnavailableException("unreadable generation response", e);
        }
        List<ScriptDraft> drafts = new ArrayList<>();
        for (JsonNode node : root.path("variants")) {
            Optional<VariantStyle> style = VariantStyle.fromKey(node.path("style_key").asText(""));
            String text = node.path("script_text").asText("").strip();
            if (style.isEmpty() || text.length() < Rescorer.MIN_SCRIPT_LENGTH) {
                continue;
            }
            String rationale = node.path("rationale").asText("");
            drafts.add(new ScriptDraft(style.get().key(), style.get().label(), text,
                rationale.isBlank() ? style.get().rationale() : rationale, VariantSource.GENERATED));
        }
        return drafts;
    }
}
