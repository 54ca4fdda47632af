package com.ledgerlens.pipeline.vision;

import com.ledgerlens.domain.DocumentType;

/**
 * One rendered page sent to the vision model, with the document type hint (may be null).
 */
public record VisionRequest(byte[] image, String mimeType, DocumentType documentTypeHint) {
}
