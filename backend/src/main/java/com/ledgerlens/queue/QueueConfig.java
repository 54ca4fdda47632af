package com.ledgerlens.queue;

import com.ledgerlens.common.RetryPolicy;
import com.ledgerlens.config.AsyncConfig;
import com.ledgerlens.config.SchedulerConfig;
import com.ledgerlens.queue.job.AnalysisStatusPollJob;
import com.ledgerlens.queue.job.CompletedJob;
import com.ledgerlens.queue.job.ConfirmationRequestJob;
import com.ledgerlens.queue.job.ConfirmationResponseJob;
import com.ledgerlens.queue.job.Job;
import com.ledgerlens.queue.job.UploadJob;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * The five named queues, each draining on its own executor and sharing the scheduler for delayed re-enqueue.
 */
@Configuration
public class QueueConfig {

    @Bean
    public JobQueue<UploadJob> uploadQueue(QueueProperties props, Clock clock,
                                           @Qualifier(AsyncConfig.UPLOAD_EXECUTOR) Executor executor,
                                           @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler) {
        return queue(QueueNames.DOCUMENT_UPLOAD, props.getUploadWorkers(), executor, scheduler, props, clock);
    }

    @Bean
    public JobQueue<AnalysisStatusPollJob> analysisQueue(QueueProperties props, Clock clock,
                                                         @Qualifier(AsyncConfig.ANALYSIS_EXECUTOR) Executor executor,
                                                         @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler) {
        return queue(QueueNames.DOCUMENT_ANALYSIS, props.getAnalysisWorkers(), executor, scheduler, props, clock);
    }

    @Bean
    public JobQueue<CompletedJob> completedQueue(QueueProperties props, Clock clock,
                                                 @Qualifier(AsyncConfig.COMPLETED_EXECUTOR) Executor executor,
                                                 @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler) {
        return queue(QueueNames.DOCUMENT_COMPLETED, props.getCompletedWorkers(), executor, scheduler, props, clock);
    }

    @Bean
    public JobQueue<ConfirmationRequestJob> confirmationQueue(QueueProperties props, Clock clock,
                                                              @Qualifier(AsyncConfig.CONFIRMATION_EXECUTOR) Executor executor,
                                                              @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler) {
        return queue(QueueNames.DOCUMENT_CONFIRMATION, props.getConfirmationWorkers(), executor, scheduler, props,
                clock);
    }

    @Bean
    public JobQueue<ConfirmationResponseJob> confirmationResponseQueue(
            QueueProperties props, Clock clock,
            @Qualifier(AsyncConfig.CONFIRMATION_RESPONSE_EXECUTOR) Executor executor,
            @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler) {
        return queue(QueueNames.CONFIRMATION_RESPONSE, props.getConfirmationResponseWorkers(), executor, scheduler,
                props, clock);
    }

    private static <J extends Job> JobQueue<J> queue(
            String name, int workers, Executor executor, TaskScheduler scheduler, QueueProperties props, Clock clock) {
        RetryPolicy retryPolicy = new RetryPolicy(props.getRetryBaseDelayMs(), 0.0, props.getMaxAttempts());
        return new JobQueue<>(name, workers, executor, scheduler, retryPolicy, props.getKeepCompleted(),
                props.getKeepFailed(), clock);
    }
}
