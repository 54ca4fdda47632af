package com.ledgerlens.domain;

/**
 * Independent classifier that contributed an opinion: rule-based text classification (OCR), the verifier model
 * (LLM) or the vision model.
 */
public enum AnalysisSource {
    OCR("OCR Classification"),
    LLM("LLM Verification"),
    VISION("OpenAI Vision");

    private final String displayName;

    AnalysisSource(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
