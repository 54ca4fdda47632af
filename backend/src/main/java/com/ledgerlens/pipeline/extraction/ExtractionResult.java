package com.ledgerlens.pipeline.extraction;

import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.OcrPayload;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Extractor answer. PROCESSING carries a job id to poll; COMPLETED carries the extracted data; FAILED an error.
 */
public record ExtractionResult(
        ExtractionStatus status,
        String jobId,
        String text,
        List<BigDecimal> amounts,
        List<String> dates,
        Map<String, String> keyValues,
        int tableCount,
        String merchant,
        DocumentType documentType,
        String language,
        String error
) {

    public static ExtractionResult processing(String jobId) {
        return new ExtractionResult(ExtractionStatus.PROCESSING, jobId, null, null, null, null, 0, null, null, null, null);
    }

    public static ExtractionResult failed(String error) {
        return new ExtractionResult(ExtractionStatus.FAILED, null, null, null, null, null, 0, null, null, null, error);
    }

    public OcrPayload toPayload() {
        return new OcrPayload(text, amounts, dates, keyValues, tableCount, merchant, documentType,
                language == null ? "es" : language);
    }
}
