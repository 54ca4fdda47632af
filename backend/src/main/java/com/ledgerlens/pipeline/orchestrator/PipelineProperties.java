package com.ledgerlens.pipeline.orchestrator;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Orchestrator timing config.
 */
@ConfigurationProperties(prefix = "ledgerlens.pipeline")
@NoArgsConstructor
@Getter
@Setter
public class PipelineProperties {

    /**
     * Upper bound (ms) for the whole OCR stage, including polling of an async extractor job. Default 60s.
     */
    private long ocrTimeoutMs = 60_000;

    /** Interval (ms) between extractor result polls while the job reports PROCESSING. */
    private long ocrPollIntervalMs = 2_000;
}
