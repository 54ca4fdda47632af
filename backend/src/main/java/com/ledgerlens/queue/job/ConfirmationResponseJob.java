package com.ledgerlens.queue.job;

import java.time.Instant;

/**
 * A user's yes/no reply. {@code processingLogId} is null when the reply targets whatever is pending.
 */
public record ConfirmationResponseJob(
        String jobId,
        String userId,
        boolean confirmed,
        String message,
        String processingLogId
) implements Job {

    public static ConfirmationResponseJob create(String userId, boolean confirmed, String message,
                                                 String processingLogId, Instant now) {
        return new ConfirmationResponseJob("confirmation-response-" + userId + "-" + now.toEpochMilli(), userId,
                confirmed, message, processingLogId);
    }
}
