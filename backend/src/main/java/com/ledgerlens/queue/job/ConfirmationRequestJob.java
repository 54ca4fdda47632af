package com.ledgerlens.queue.job;

import com.ledgerlens.domain.ClassificationResult;

import java.time.Instant;

/**
 * Sends the confirmation summary of a merged result to its user.
 */
public record ConfirmationRequestJob(
        String jobId,
        String userId,
        String processingLogId,
        ClassificationResult transaction,
        double confidence
) implements Job {

    public static ConfirmationRequestJob create(String userId, String processingLogId,
                                                ClassificationResult transaction, double confidence, Instant now) {
        return new ConfirmationRequestJob("confirmation-" + processingLogId + "-" + now.toEpochMilli(), userId,
                processingLogId, transaction, confidence);
    }
}
