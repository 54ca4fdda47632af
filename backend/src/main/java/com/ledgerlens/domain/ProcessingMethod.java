package com.ledgerlens.domain;

/**
 * How a stored transaction was produced. Pipeline transactions are always USER_CONFIRMED.
 */
public enum ProcessingMethod {
    AUTO_OCR,
    AUTO_LLM,
    HYBRID,
    MANUAL,
    USER_CONFIRMED
}
