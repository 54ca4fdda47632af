package com.ledgerlens.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.adapter.analyzer.AnalyzerProperties;
import com.ledgerlens.adapter.analyzer.WebClientDocumentExtractor;
import com.ledgerlens.adapter.analyzer.WebClientDocumentImageRenderer;
import com.ledgerlens.adapter.openai.ModelClientProperties;
import com.ledgerlens.adapter.openai.OpenAiChatClient;
import com.ledgerlens.adapter.openai.OpenAiVerifierModelClient;
import com.ledgerlens.adapter.openai.OpenAiVisionModelClient;
import com.ledgerlens.adapter.stream.EventStreamProperties;
import com.ledgerlens.adapter.stream.WebClientUploadEventStream;
import com.ledgerlens.ingestion.UploadEventStream;
import com.ledgerlens.pipeline.extraction.DocumentExtractor;
import com.ledgerlens.pipeline.extraction.DocumentImageRenderer;
import com.ledgerlens.pipeline.verifier.VerifierModelClient;
import com.ledgerlens.pipeline.vision.VisionModelClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * HTTP adapters behind the pipeline ports, with one local rate limiter per remote service.
 * {@link WebClient.Builder} is a prototype bean, so every client gets its own builder.
 */
@Configuration
public class AdapterConfig {

    public static final String MODEL_RATE_LIMITER = "modelRateLimiter";
    public static final String ANALYZER_RATE_LIMITER = "analyzerRateLimiter";

    @Bean(name = MODEL_RATE_LIMITER)
    public RateLimiter modelRateLimiter(ModelClientProperties properties) {
        return rateLimiter("model", properties.getMaxRequestsPerSecond(), properties.getLimiterTimeoutMs());
    }

    @Bean(name = ANALYZER_RATE_LIMITER)
    public RateLimiter analyzerRateLimiter(AnalyzerProperties properties) {
        return rateLimiter("analyzer", properties.getMaxRequestsPerSecond(), properties.getLimiterTimeoutMs());
    }

    @Bean
    public OpenAiChatClient openAiChatClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                             ModelClientProperties properties,
                                             @Qualifier(MODEL_RATE_LIMITER) RateLimiter modelRateLimiter) {
        return new OpenAiChatClient(webClientBuilder, objectMapper, properties, modelRateLimiter);
    }

    @Bean
    public VisionModelClient visionModelClient(OpenAiChatClient chatClient, ObjectMapper objectMapper,
                                               ModelClientProperties properties) {
        return new OpenAiVisionModelClient(chatClient, objectMapper, properties);
    }

    @Bean
    public VerifierModelClient verifierModelClient(OpenAiChatClient chatClient, ObjectMapper objectMapper,
                                                   ModelClientProperties properties) {
        return new OpenAiVerifierModelClient(chatClient, objectMapper, properties);
    }

    @Bean
    public DocumentExtractor documentExtractor(WebClient.Builder webClientBuilder, AnalyzerProperties properties,
                                               @Qualifier(ANALYZER_RATE_LIMITER) RateLimiter analyzerRateLimiter) {
        return new WebClientDocumentExtractor(webClientBuilder, properties, analyzerRateLimiter);
    }

    @Bean
    public DocumentImageRenderer documentImageRenderer(WebClient.Builder webClientBuilder,
                                                       AnalyzerProperties properties,
                                                       @Qualifier(ANALYZER_RATE_LIMITER) RateLimiter analyzerRateLimiter) {
        return new WebClientDocumentImageRenderer(webClientBuilder, properties, analyzerRateLimiter);
    }

    @Bean
    public UploadEventStream uploadEventStream(WebClient.Builder webClientBuilder, EventStreamProperties properties) {
        return new WebClientUploadEventStream(webClientBuilder, properties);
    }

    private static RateLimiter rateLimiter(String name, int maxRequestsPerSecond, long timeoutMs) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, maxRequestsPerSecond))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, timeoutMs)))
                .build();
        return RateLimiter.of(name, config);
    }
}
