package com.ledgerlens.pipeline.extraction;

/**
 * One page of a document rendered as an image for multimodal analysis.
 */
public record RenderedPage(int pageNumber, byte[] data, String mimeType) {
}
