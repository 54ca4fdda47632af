package com.ledgerlens.pipeline.extraction;

import java.util.Set;

/**
 * Text/table/key-value extraction service. Implementations may answer synchronously (COMPLETED / FAILED) or with
 * an async job id (PROCESSING) that is later polled through {@link #getResult(String)}.
 */
public interface DocumentExtractor {

    /**
     * @throws ExtractionException when the call itself fails (transport, auth, malformed answer)
     */
    ExtractionResult analyze(StorageReference document, Set<ExtractionFeature> features);

    ExtractionResult getResult(String jobId);
}
