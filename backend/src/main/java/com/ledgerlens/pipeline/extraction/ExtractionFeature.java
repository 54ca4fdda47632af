package com.ledgerlens.pipeline.extraction;

public enum ExtractionFeature {
    TEXT_DETECTION,
    KEY_VALUE_DETECTION,
    TABLE_EXTRACTION,
    DOCUMENT_CLASSIFICATION,
    LANGUAGE_CLASSIFICATION
}
