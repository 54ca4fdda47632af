package com.ledgerlens.pipeline.extraction;

/**
 * Thrown when the extractor or renderer cannot be reached or returns an unusable answer.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
