package com.ledgerlens.adapter.analyzer;

import com.ledgerlens.pipeline.extraction.DocumentImageRenderer;
import com.ledgerlens.pipeline.extraction.ExtractionException;
import com.ledgerlens.pipeline.extraction.RenderedPage;
import com.ledgerlens.pipeline.extraction.StorageReference;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Page rendering through the analysis service. Undecodable pages are skipped.
 */
@Slf4j
public class WebClientDocumentImageRenderer implements DocumentImageRenderer {

    private final WebClient webClient;
    private final AnalyzerProperties properties;
    private final RateLimiter analyzerRateLimiter;

    public WebClientDocumentImageRenderer(WebClient.Builder builder, AnalyzerProperties properties,
                                          RateLimiter analyzerRateLimiter) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.analyzerRateLimiter = analyzerRateLimiter;
    }

    @Override
    public List<RenderedPage> render(StorageReference document) {
        if (!analyzerRateLimiter.acquirePermission()) {
            throw new ExtractionException("Local limiter timeout before rendering " + document.objectName());
        }
        RenderResponse response;
        try {
            response = webClient.post()
                    .uri("/render")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of(
                            "namespace", String.valueOf(document.namespace()),
                            "bucketName", String.valueOf(document.bucketName()),
                            "objectName", String.valueOf(document.objectName())))
                    .retrieve()
                    .bodyToMono(RenderResponse.class)
                    .onErrorMap(WebClientResponseException.class,
                            e -> new ExtractionException("Renderer HTTP " + e.getStatusCode().value(), e))
                    .block(Duration.ofMillis(properties.getRenderTimeoutMs()));
        } catch (ExtractionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExtractionException("Rendering failed for " + document.objectName() + ": " + e.getMessage(), e);
        }
        return toPages(response);
    }

    static List<RenderedPage> toPages(RenderResponse response) {
        if (response == null || response.pages() == null) {
            return List.of();
        }
        List<RenderedPage> pages = new ArrayList<>();
        for (RenderResponse.Page page : response.pages()) {
            if (page.data() == null || page.data().isBlank()) {
                continue;
            }
            try {
                byte[] bytes = Base64.getDecoder().decode(page.data());
                pages.add(new RenderedPage(page.pageNumber() == null ? pages.size() + 1 : page.pageNumber(), bytes,
                        page.mimeType() == null ? "image/png" : page.mimeType()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping page {} with invalid base64 data", page.pageNumber());
            }
        }
        return pages;
    }
}
