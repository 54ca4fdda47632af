package com.ledgerlens.pipeline.vision;

/**
 * The vision model answered, but not in the requested schema. Retried before falling back to raw JSON.
 */
public class VisionSchemaException extends RuntimeException {

    public VisionSchemaException(String message) {
        super(message);
    }

    public VisionSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
