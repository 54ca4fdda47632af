package com.ledgerlens.pipeline.classifier;

import com.ledgerlens.domain.OcrPayload;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Classifier input built from the OCR stage. Text is empty when OCR failed.
 */
public record ExtractedDocument(
        String text,
        List<BigDecimal> amounts,
        List<String> dates,
        String merchant,
        Map<String, String> keyValues
) {

    public ExtractedDocument {
        text = text == null ? "" : text;
        amounts = amounts == null ? List.of() : List.copyOf(amounts);
        dates = dates == null ? List.of() : List.copyOf(dates);
        keyValues = keyValues == null ? Map.of() : Map.copyOf(keyValues);
    }

    public static ExtractedDocument from(OcrPayload payload) {
        if (payload == null) {
            return new ExtractedDocument("", List.of(), List.of(), null, Map.of());
        }
        return new ExtractedDocument(payload.text(), payload.amounts(), payload.dates(), payload.merchant(),
                payload.keyValues());
    }
}
