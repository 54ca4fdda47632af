package com.ledgerlens.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * One source's guess at the transaction behind a document. Confidence is always within [0,1].
 */
public record ClassificationResult(
        TransactionType transactionType,
        String category,
        String subcategory,
        BigDecimal amount,
        String currency,
        LocalDate transactionDate,
        String description,
        String merchant,
        double confidence,
        String reasoning,
        Map<String, Object> extractedEntities,
        AnalysisSource source
) {

    public ClassificationResult {
        confidence = clamp(confidence);
        amount = amount == null ? BigDecimal.ZERO : amount;
        currency = currency == null || currency.isBlank() ? "CLP" : currency;
        extractedEntities = extractedEntities == null ? Map.of() : extractedEntities;
    }

    public ClassificationResult withSource(AnalysisSource newSource) {
        return new ClassificationResult(transactionType, category, subcategory, amount, currency, transactionDate,
                description, merchant, confidence, reasoning, extractedEntities, newSource);
    }

    public ClassificationResult withConfidence(double newConfidence) {
        return new ClassificationResult(transactionType, category, subcategory, amount, currency, transactionDate,
                description, merchant, newConfidence, reasoning, extractedEntities, source);
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
