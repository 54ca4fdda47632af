package com.ledgerlens.adapter.openai;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenAI-compatible chat completions endpoint used for vision and verification calls.
 */
@ConfigurationProperties(prefix = "ledgerlens.model")
@NoArgsConstructor
@Getter
@Setter
public class ModelClientProperties {

    private String baseUrl = "https://api.openai.com/v1";

    /** Bearer token; usually injected from the environment. */
    private String apiKey;

    /** Multimodal model for page images. */
    private String visionModel = "gpt-4o-mini";

    /** Text model that verifies the rule-based classification. */
    private String verifierModel = "gpt-4o-mini";

    private double temperature = 0.1;

    /** Per-call response timeout (ms). */
    private long requestTimeoutMs = 60_000;

    /** Local limiter: calls per second shared by vision and verifier. */
    private int maxRequestsPerSecond = 5;

    /** Max wait (ms) for a limiter permit before the call fails. */
    private long limiterTimeoutMs = 30_000;
}
