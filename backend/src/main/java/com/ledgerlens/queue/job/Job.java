package com.ledgerlens.queue.job;

/**
 * Unit of work on one of the named queues. Higher priority is taken first; equal priorities run in FIFO order.
 */
public sealed interface Job
        permits UploadJob, AnalysisStatusPollJob, CompletedJob, ConfirmationRequestJob, ConfirmationResponseJob {

    String jobId();

    default int priority() {
        return 0;
    }
}
