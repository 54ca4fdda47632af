package com.ledgerlens.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Extractor output kept on the log: text, detected amounts/dates, key-values and the document classification.
 */
public record OcrPayload(
        String text,
        List<BigDecimal> amounts,
        List<String> dates,
        Map<String, String> keyValues,
        int tableCount,
        String merchant,
        DocumentType detectedDocumentType,
        String language
) implements StagePayload {

    public OcrPayload {
        text = text == null ? "" : text;
        amounts = amounts == null ? List.of() : List.copyOf(amounts);
        dates = dates == null ? List.of() : List.copyOf(dates);
        keyValues = keyValues == null ? Map.of() : Map.copyOf(keyValues);
    }

    public static OcrPayload empty() {
        return new OcrPayload("", List.of(), List.of(), Map.of(), 0, null, null, "es");
    }

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.OCR_EXTRACTION;
    }
}
