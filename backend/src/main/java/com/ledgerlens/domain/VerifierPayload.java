package com.ledgerlens.domain;

import java.util.List;

/**
 * Verifier answer plus its comparison against the rule-based classification.
 */
public record VerifierPayload(
        ClassificationResult result,
        List<String> discrepancies,
        AnalysisSource recommendedSource,
        double combinedConfidence,
        List<String> insights
) implements StagePayload {

    public VerifierPayload {
        discrepancies = discrepancies == null ? List.of() : List.copyOf(discrepancies);
        insights = insights == null ? List.of() : List.copyOf(insights);
    }

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.LLM_VERIFICATION;
    }
}
