package com.ledgerlens.queue;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Worker counts per queue, retry backoff and retention of finished job records.
 */
@ConfigurationProperties(prefix = "ledgerlens.queue")
@NoArgsConstructor
@Getter
@Setter
public class QueueProperties {

    /** Worker loops on document-upload. Default 5 (match upload-executor size). */
    private int uploadWorkers = 5;

    /** Worker loops on document-analysis. Default 3 (match analysis-executor size). */
    private int analysisWorkers = 3;

    /** Worker loops on document-completed. Default 10 (match completed-executor size). */
    private int completedWorkers = 10;

    /** Worker loops on document-confirmation. Default 5 (match confirmation-executor size). */
    private int confirmationWorkers = 5;

    /** Worker loops on transaction-confirmation-response. Default 3 (match confirmation-response-executor size). */
    private int confirmationResponseWorkers = 3;

    /** Attempts per job, first run included. */
    private int maxAttempts = 3;

    /** Base delay (ms) for exponential retry backoff. */
    private long retryBaseDelayMs = 2_000;

    /** Finished job records kept per queue. */
    private int keepCompleted = 100;
    private int keepFailed = 50;
}
