package com.ledgerlens.adapter.analyzer;

import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.pipeline.extraction.DocumentExtractor;
import com.ledgerlens.pipeline.extraction.ExtractionException;
import com.ledgerlens.pipeline.extraction.ExtractionFeature;
import com.ledgerlens.pipeline.extraction.ExtractionResult;
import com.ledgerlens.pipeline.extraction.ExtractionStatus;
import com.ledgerlens.pipeline.extraction.StorageReference;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extraction over HTTP. The service answers inline for small documents and with a job id otherwise.
 */
@Slf4j
public class WebClientDocumentExtractor implements DocumentExtractor {

    private final WebClient webClient;
    private final AnalyzerProperties properties;
    private final RateLimiter analyzerRateLimiter;

    public WebClientDocumentExtractor(WebClient.Builder builder, AnalyzerProperties properties,
                                      RateLimiter analyzerRateLimiter) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.analyzerRateLimiter = analyzerRateLimiter;
    }

    @Override
    public ExtractionResult analyze(StorageReference document, Set<ExtractionFeature> features) {
        Map<String, Object> body = Map.of(
                "namespace", nullToEmpty(document.namespace()),
                "bucketName", nullToEmpty(document.bucketName()),
                "objectName", nullToEmpty(document.objectName()),
                "features", features.stream().map(Enum::name).sorted().toList());
        return call("analyze " + document.objectName(), webClient.post()
                .uri("/analyses")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(AnalysisResponse.class));
    }

    @Override
    public ExtractionResult getResult(String jobId) {
        return call("result " + jobId, webClient.get()
                .uri("/analyses/{jobId}", jobId)
                .retrieve()
                .bodyToMono(AnalysisResponse.class));
    }

    private ExtractionResult call(String what, Mono<AnalysisResponse> request) {
        acquire(what);
        AnalysisResponse response;
        try {
            response = request
                    .onErrorMap(WebClientResponseException.class,
                            e -> new ExtractionException("Extractor HTTP " + e.getStatusCode().value() + " on " + what, e))
                    .block(Duration.ofMillis(properties.getRequestTimeoutMs()));
        } catch (ExtractionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExtractionException("Extractor call failed on " + what + ": " + e.getMessage(), e);
        }
        if (response == null) {
            throw new ExtractionException("Extractor returned no body on " + what);
        }
        return toResult(response);
    }

    private void acquire(String what) {
        long start = System.nanoTime();
        if (!analyzerRateLimiter.acquirePermission()) {
            throw new ExtractionException("Local limiter timeout before extractor " + what);
        }
        long waitedMs = (System.nanoTime() - start) / 1_000_000L;
        if (waitedMs > 1_000) {
            log.info("Analyzer limiter delayed {} ms before {}", waitedMs, what);
        }
    }

    static ExtractionResult toResult(AnalysisResponse r) {
        ExtractionStatus status = parseStatus(r.status());
        return switch (status) {
            case PROCESSING -> {
                if (r.jobId() == null || r.jobId().isBlank()) {
                    throw new ExtractionException("Extractor reported PROCESSING without a job id");
                }
                yield ExtractionResult.processing(r.jobId());
            }
            case FAILED -> ExtractionResult.failed(r.error() == null ? "Extraction failed" : r.error());
            case COMPLETED -> new ExtractionResult(ExtractionStatus.COMPLETED, r.jobId(),
                    r.text() == null ? "" : r.text(),
                    r.amounts() == null ? List.of() : r.amounts(),
                    r.dates() == null ? List.of() : r.dates(),
                    r.keyValues() == null ? Map.of() : r.keyValues(),
                    r.tableCount() == null ? 0 : r.tableCount(),
                    r.merchant(),
                    DocumentType.fromHint(r.documentType()),
                    r.language(),
                    null);
        };
    }

    private static ExtractionStatus parseStatus(String status) {
        if (status == null) {
            throw new ExtractionException("Extractor answer has no status");
        }
        return switch (status.trim().toUpperCase(Locale.ROOT)) {
            case "PROCESSING", "IN_PROGRESS", "ACCEPTED" -> ExtractionStatus.PROCESSING;
            case "COMPLETED", "SUCCEEDED" -> ExtractionStatus.COMPLETED;
            case "FAILED", "CANCELED" -> ExtractionStatus.FAILED;
            default -> throw new ExtractionException("Unknown extractor status: " + status);
        };
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
