package com.ledgerlens.queue;

import com.ledgerlens.queue.job.AnalysisStatusPollJob;
import com.ledgerlens.queue.job.CompletedJob;
import com.ledgerlens.queue.job.ConfirmationRequestJob;
import com.ledgerlens.queue.job.ConfirmationResponseJob;
import com.ledgerlens.queue.job.UploadJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single entry point for enqueueing work on the named queues.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueueService {

    private final JobQueue<UploadJob> uploadQueue;
    private final JobQueue<AnalysisStatusPollJob> analysisQueue;
    private final JobQueue<CompletedJob> completedQueue;
    private final JobQueue<ConfirmationRequestJob> confirmationQueue;
    private final JobQueue<ConfirmationResponseJob> confirmationResponseQueue;

    public String addUploadJob(UploadJob job) {
        uploadQueue.add(job);
        log.info("Upload job {} queued for {} (user {}, source {})",
                job.jobId(), job.objectName(), job.userId(), job.source());
        return job.jobId();
    }

    public String addAnalysisJob(AnalysisStatusPollJob job) {
        analysisQueue.add(job);
        return job.jobId();
    }

    public String addAnalysisJob(AnalysisStatusPollJob job, long delayMs) {
        analysisQueue.addDelayed(job, delayMs);
        return job.jobId();
    }

    public String addCompletedJob(CompletedJob job) {
        completedQueue.add(job);
        return job.jobId();
    }

    public String addConfirmationRequestJob(ConfirmationRequestJob job) {
        confirmationQueue.add(job);
        return job.jobId();
    }

    public String addConfirmationResponseJob(ConfirmationResponseJob job) {
        confirmationResponseQueue.add(job);
        return job.jobId();
    }

    public List<QueueStats> getQueueStats() {
        return List.of(uploadQueue.stats(), analysisQueue.stats(), completedQueue.stats(),
                confirmationQueue.stats(), confirmationResponseQueue.stats());
    }
}
