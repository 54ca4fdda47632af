package com.ledgerlens.pipeline.verifier;

import com.ledgerlens.domain.AnalysisSource;
import com.ledgerlens.domain.ClassificationResult;

import java.util.List;

/**
 * Verifier vs rule-based comparison: discrepancies found, which answer to prefer, and the combined confidence.
 */
public record ClassificationComparison(
        List<String> discrepancies,
        ClassificationResult recommended,
        AnalysisSource recommendedSource,
        double combinedConfidence
) {

    public boolean hasDiscrepancies() {
        return !discrepancies.isEmpty();
    }
}
