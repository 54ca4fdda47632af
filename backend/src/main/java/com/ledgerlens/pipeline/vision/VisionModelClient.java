package com.ledgerlens.pipeline.vision;

/**
 * Multimodal model behind the vision stage.
 */
public interface VisionModelClient {

    /**
     * Asks for an answer constrained to the {@link VisionModelReply} schema.
     *
     * @throws VisionSchemaException when the model answered but the answer does not validate against the schema
     */
    VisionModelReply analyzeStructured(VisionRequest request);

    /**
     * Free-form prompt asking for raw JSON in the same shape; the caller parses the returned text.
     */
    String analyzeRaw(VisionRequest request);
}
