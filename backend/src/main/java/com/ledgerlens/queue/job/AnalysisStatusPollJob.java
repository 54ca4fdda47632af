package com.ledgerlens.queue.job;

import java.time.Instant;

/**
 * Checks an asynchronous extractor job until it settles or the remaining attempts run out.
 */
public record AnalysisStatusPollJob(
        String jobId,
        String extractorJobId,
        String processingLogId,
        String userId,
        String objectName,
        int attemptsRemaining,
        long retryDelayMs,
        Instant submittedAt
) implements Job {

    public static final int DEFAULT_ATTEMPTS = 10;
    public static final long DEFAULT_RETRY_DELAY_MS = 30_000;

    public static AnalysisStatusPollJob create(String extractorJobId, String processingLogId, String userId,
                                               String objectName, Instant now) {
        return new AnalysisStatusPollJob("analysis-" + extractorJobId + "-" + now.toEpochMilli(), extractorJobId,
                processingLogId, userId, objectName, DEFAULT_ATTEMPTS, DEFAULT_RETRY_DELAY_MS, now);
    }

    /** Same poll with a fresh id and fewer attempts left. */
    public AnalysisStatusPollJob next(int remaining, Instant now) {
        return new AnalysisStatusPollJob("analysis-" + extractorJobId + "-" + now.toEpochMilli(), extractorJobId,
                processingLogId, userId, objectName, remaining, retryDelayMs, submittedAt);
    }
}
