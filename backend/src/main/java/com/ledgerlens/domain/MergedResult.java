package com.ledgerlens.domain;

import java.util.List;

/**
 * Final answer after merging the available sources; embedded in the processing log, never stored alone.
 */
public record MergedResult(
        ClassificationResult finalResult,
        double finalConfidence,
        List<String> sourcesUsed,
        List<String> discrepancies,
        String reasoning
) {

    public MergedResult {
        finalConfidence = ClassificationResult.clamp(finalConfidence);
        sourcesUsed = sourcesUsed == null ? List.of() : List.copyOf(sourcesUsed);
        discrepancies = discrepancies == null ? List.of() : List.copyOf(discrepancies);
    }
}
