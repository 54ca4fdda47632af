package com.ledgerlens.queue.job;

import java.time.Instant;

/**
 * Terminal notice for an upload or analysis: handed to every completion listener.
 */
public record CompletedJob(
        String jobId,
        String processingLogId,
        String userId,
        String objectName,
        CompletionStatus status,
        String error,
        double confidence,
        long processingTimeMs
) implements Job {

    public static CompletedJob completed(String key, String processingLogId, String userId, String objectName,
                                         double confidence, long processingTimeMs, Instant now) {
        return new CompletedJob(id(key, now), processingLogId, userId, objectName, CompletionStatus.COMPLETED, null,
                confidence, processingTimeMs);
    }

    public static CompletedJob failed(String key, String processingLogId, String userId, String objectName,
                                      String error, long processingTimeMs, Instant now) {
        return new CompletedJob(id(key, now), processingLogId, userId, objectName, CompletionStatus.FAILED, error,
                0.0, processingTimeMs);
    }

    private static String id(String key, Instant now) {
        return "completed-" + key + "-" + now.toEpochMilli();
    }
}
