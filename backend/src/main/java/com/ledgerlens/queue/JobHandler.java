package com.ledgerlens.queue;

import com.ledgerlens.queue.job.Job;

/**
 * Worker logic for one queue. Throwing fails the attempt; the queue retries with backoff.
 */
public interface JobHandler<J extends Job> {

    void handle(J job) throws Exception;

    /** Called once when the last attempt has failed. */
    default void onExhausted(J job, Exception lastError) {
    }
}
