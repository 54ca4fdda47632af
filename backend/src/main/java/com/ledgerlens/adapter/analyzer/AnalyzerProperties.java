package com.ledgerlens.adapter.analyzer;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Document analysis service (text extraction and page rendering).
 */
@ConfigurationProperties(prefix = "ledgerlens.analyzer")
@NoArgsConstructor
@Getter
@Setter
public class AnalyzerProperties {

    private String baseUrl = "http://localhost:8090";

    private long requestTimeoutMs = 30_000;

    /** Rendering PDFs can be slow; separate timeout (ms). */
    private long renderTimeoutMs = 60_000;

    private int maxRequestsPerSecond = 10;

    private long limiterTimeoutMs = 10_000;
}
