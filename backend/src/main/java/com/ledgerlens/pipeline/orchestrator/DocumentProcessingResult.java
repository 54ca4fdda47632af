package com.ledgerlens.pipeline.orchestrator;

import com.ledgerlens.domain.ProcessingStatus;

import java.util.Optional;

/**
 * Outcome of one pipeline run. The transaction id is always empty: transactions are created only after the user
 * confirms.
 */
public record DocumentProcessingResult(
        boolean success,
        Optional<String> transactionId,
        String processingLogId,
        ProcessingStatus status,
        double confidence,
        long processingTimeMs,
        String error
) {

    public static DocumentProcessingResult pendingConfirmation(String logId, double confidence, long elapsedMs) {
        return new DocumentProcessingResult(true, Optional.empty(), logId, ProcessingStatus.PENDING_CONFIRMATION,
                confidence, elapsedMs, null);
    }

    public static DocumentProcessingResult failed(String logId, long elapsedMs, String error) {
        return new DocumentProcessingResult(false, Optional.empty(), logId, ProcessingStatus.FAILED, 0.0, elapsedMs,
                error);
    }
}
