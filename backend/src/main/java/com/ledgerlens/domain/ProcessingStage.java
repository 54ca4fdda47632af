package com.ledgerlens.domain;

/**
 * Pipeline stage recorded as {@code currentStage} on the processing log. Names are a published contract.
 */
public enum ProcessingStage {
    DOCUMENT_UPLOAD,
    OCR_EXTRACTION,
    DOCUMENT_CLASSIFICATION,
    TEXT_ANALYSIS,
    LLM_VERIFICATION,
    TRANSACTION_CREATION,
    CONFIDENCE_SCORING,
    FINAL_VALIDATION,
    VISION_ANALYSIS,
    USER_CONFIRMATION,
    CONFIRMATION_PROCESSING
}
