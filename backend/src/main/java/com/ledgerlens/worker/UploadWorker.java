package com.ledgerlens.worker;

import com.ledgerlens.pipeline.extraction.StorageReference;
import com.ledgerlens.pipeline.orchestrator.DocumentProcessingOrchestrator;
import com.ledgerlens.pipeline.orchestrator.DocumentProcessingRequest;
import com.ledgerlens.pipeline.orchestrator.DocumentProcessingResult;
import com.ledgerlens.queue.JobHandler;
import com.ledgerlens.queue.JobQueue;
import com.ledgerlens.queue.QueueService;
import com.ledgerlens.queue.job.CompletedJob;
import com.ledgerlens.queue.job.UploadJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Drains document-upload: runs the pipeline for each uploaded document. A failed run is retried; the failure
 * notice is emitted once the last attempt has failed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UploadWorker implements JobHandler<UploadJob> {

    private final JobQueue<UploadJob> uploadQueue;
    private final DocumentProcessingOrchestrator orchestrator;
    private final QueueService queueService;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        uploadQueue.start(this);
    }

    @Override
    public void handle(UploadJob job) {
        log.info("Processing upload {} ({})", job.objectName(), job.jobId());
        DocumentProcessingResult result = orchestrator.process(new DocumentProcessingRequest(
                job.objectId(),
                job.userId(),
                new StorageReference(job.namespace(), job.bucketName(), job.objectName(), job.objectId()),
                job.source(),
                job.documentType()));
        if (!result.success()) {
            throw new JobExecutionException("Document processing failed: " + result.error());
        }
        queueService.addCompletedJob(CompletedJob.completed(result.processingLogId(), result.processingLogId(),
                job.userId(), job.objectName(), result.confidence(), result.processingTimeMs(), Instant.now(clock)));
    }

    @Override
    public void onExhausted(UploadJob job, Exception lastError) {
        queueService.addCompletedJob(CompletedJob.failed(job.objectId(), null, job.userId(), job.objectName(),
                lastError.getMessage(), elapsedSinceEvent(job), Instant.now(clock)));
    }

    private long elapsedSinceEvent(UploadJob job) {
        return job.eventTime() == null ? 0 : Math.max(0, clock.millis() - job.eventTime().toEpochMilli());
    }
}
