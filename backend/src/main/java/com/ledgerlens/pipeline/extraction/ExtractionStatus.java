package com.ledgerlens.pipeline.extraction;

public enum ExtractionStatus {
    PROCESSING,
    COMPLETED,
    FAILED
}
