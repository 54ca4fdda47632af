package com.ledgerlens.adapter.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions over WebClient. Calls are blocking from the caller's point of view and pass the shared local
 * rate limiter first.
 */
@Slf4j
public class OpenAiChatClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ModelClientProperties properties;
    private final RateLimiter modelRateLimiter;

    public OpenAiChatClient(WebClient.Builder builder, ObjectMapper objectMapper, ModelClientProperties properties,
                            RateLimiter modelRateLimiter) {
        WebClient.Builder b = builder.baseUrl(properties.getBaseUrl());
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            b = b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        this.webClient = b.build();
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.modelRateLimiter = modelRateLimiter;
    }

    /**
     * @param responseFormat OpenAI {@code response_format} object; null for free text
     * @return the first choice's message content
     */
    public String complete(String model, List<Map<String, Object>> messages, Map<String, Object> responseFormat) {
        long acquireStart = System.nanoTime();
        if (!modelRateLimiter.acquirePermission()) {
            throw new ModelCallException("Local limiter timeout before chat completion on " + model);
        }
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (waitedMs > 1_000) {
            log.info("Model limiter delayed {} ms before call to {}", waitedMs, model);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("temperature", properties.getTemperature());
        if (responseFormat != null) {
            body.put("response_format", responseFormat);
        }

        String json;
        try {
            json = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(properties.getRequestTimeoutMs()));
        } catch (WebClientResponseException e) {
            throw new ModelCallException("Chat completion failed with HTTP " + e.getStatusCode().value(), e);
        } catch (IllegalStateException e) {
            throw new ModelCallException("Chat completion timed out after " + properties.getRequestTimeoutMs() + " ms", e);
        }
        return content(json);
    }

    String content(String json) {
        if (json == null || json.isBlank()) {
            throw new ModelCallException("Empty chat completion response");
        }
        try {
            JsonNode message = objectMapper.readTree(json).path("choices").path(0).path("message");
            if (message.hasNonNull("refusal")) {
                throw new ModelCallException("Model refused: " + message.get("refusal").asText());
            }
            JsonNode content = message.path("content");
            if (!content.isTextual() || content.asText().isBlank()) {
                throw new ModelCallException("Chat completion without content");
            }
            return content.asText();
        } catch (JsonProcessingException e) {
            throw new ModelCallException("Unreadable chat completion response", e);
        }
    }

    /** {@code response_format} for a strict JSON schema. */
    public static Map<String, Object> jsonSchema(String name, Map<String, Object> schema) {
        return Map.of("type", "json_schema",
                "json_schema", Map.of("name", name, "strict", true, "schema", schema));
    }

    /** {@code response_format} asking only for a JSON object. */
    public static Map<String, Object> jsonObject() {
        return Map.of("type", "json_object");
    }
}
