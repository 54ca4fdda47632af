package com.ledgerlens.worker;

import com.ledgerlens.queue.JobHandler;
import com.ledgerlens.queue.JobQueue;
import com.ledgerlens.queue.job.CompletedJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drains document-completed by fanning each job out to the completion listeners. One listener failing does not
 * stop the others.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CompletedWorker implements JobHandler<CompletedJob> {

    private final JobQueue<CompletedJob> completedQueue;
    private final List<CompletionListener> completionListeners;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        completedQueue.start(this);
    }

    @Override
    public void handle(CompletedJob job) {
        log.debug("Completed job {} ({}) for log {}", job.jobId(), job.status().label(), job.processingLogId());
        for (CompletionListener listener : completionListeners) {
            try {
                listener.onCompleted(job);
            } catch (RuntimeException e) {
                log.warn("Completion listener {} failed for job {}: {}",
                        listener.getClass().getSimpleName(), job.jobId(), e.getMessage(), e);
            }
        }
    }
}
