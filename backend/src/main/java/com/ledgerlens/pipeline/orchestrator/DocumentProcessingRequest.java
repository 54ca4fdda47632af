package com.ledgerlens.pipeline.orchestrator;

import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.UploadSource;
import com.ledgerlens.pipeline.extraction.StorageReference;

/**
 * One uploaded document to run through the pipeline. {@code documentType} is the hint derived from the object
 * name and may be null.
 */
public record DocumentProcessingRequest(
        String documentId,
        String userId,
        StorageReference storage,
        UploadSource source,
        DocumentType documentType
) {
}
