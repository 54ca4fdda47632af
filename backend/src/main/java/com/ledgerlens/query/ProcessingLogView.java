package com.ledgerlens.query;

import java.time.Instant;
import java.util.List;

/**
 * Read model of one processing log: status, stage, per-stage confidences and recorded errors.
 */
public record ProcessingLogView(
        String id,
        String documentId,
        String userId,
        String objectName,
        String source,
        String status,
        String currentStage,
        String documentType,
        String transactionId,
        Double ocrConfidence,
        Double visionConfidence,
        Double classificationConfidence,
        Double llmConfidence,
        Double overallConfidence,
        Long totalProcessingTime,
        List<StageError> errors,
        String confirmationNote,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        Instant failedAt
) {

    public record StageError(String stage, String message, Instant timestamp) {
    }
}
