package com.ledgerlens.domain;

/**
 * Processing log state. Names (and their order) are read by dashboards and the manual-review UI; do not rename.
 */
public enum ProcessingStatus {
    QUEUED,
    PROCESSING_OCR,
    PROCESSING_CLASSIFICATION,
    PROCESSING_LLM_VERIFICATION,
    COMPLETED,
    FAILED,
    TIMEOUT,
    MANUAL_REVIEW_REQUIRED,
    PROCESSING_VISION,
    PENDING_CONFIRMATION;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT || this == MANUAL_REVIEW_REQUIRED;
    }
}
