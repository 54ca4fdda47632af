package com.ledgerlens.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: one per job queue (sized to the queue's configured worker count), one for pipeline stage calls
 * that race a timeout, and a single thread for the upload-event poll loop.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String UPLOAD_EXECUTOR = "upload-executor";
    public static final String ANALYSIS_EXECUTOR = "analysis-executor";
    public static final String COMPLETED_EXECUTOR = "completed-executor";
    public static final String CONFIRMATION_EXECUTOR = "confirmation-executor";
    public static final String CONFIRMATION_RESPONSE_EXECUTOR = "confirmation-response-executor";
    public static final String PIPELINE_EXECUTOR = "pipeline-executor";
    public static final String INGESTION_EXECUTOR = "ingestion-executor";

    @Bean(name = UPLOAD_EXECUTOR)
    public Executor uploadExecutor(@Value("${ledgerlens.queue.upload-workers:5}") int workers) {
        return fixedPool(workers, "upload-");
    }

    @Bean(name = ANALYSIS_EXECUTOR)
    public Executor analysisExecutor(@Value("${ledgerlens.queue.analysis-workers:3}") int workers) {
        return fixedPool(workers, "analysis-");
    }

    @Bean(name = COMPLETED_EXECUTOR)
    public Executor completedExecutor(@Value("${ledgerlens.queue.completed-workers:10}") int workers) {
        return fixedPool(workers, "completed-");
    }

    @Bean(name = CONFIRMATION_EXECUTOR)
    public Executor confirmationExecutor(@Value("${ledgerlens.queue.confirmation-workers:5}") int workers) {
        return fixedPool(workers, "confirmation-");
    }

    @Bean(name = CONFIRMATION_RESPONSE_EXECUTOR)
    public Executor confirmationResponseExecutor(@Value("${ledgerlens.queue.confirmation-response-workers:3}") int workers) {
        return fixedPool(workers, "confirmation-resp-");
    }

    /**
     * OCR calls run here so the orchestrator can bound them with a timeout. One thread per upload worker, with
     * headroom for timed-out tasks still unwinding; no queue, so a task never waits while its timeout runs.
     */
    @Bean(name = PIPELINE_EXECUTOR)
    public ThreadPoolTaskExecutor pipelineExecutor(@Value("${ledgerlens.queue.upload-workers:5}") int uploadWorkers) {
        int size = Math.max(1, uploadWorkers);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size * 2);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("pipeline-");
        e.initialize();
        return e;
    }

    /** Single thread: the upload-event poll loop is not re-entrant. */
    @Bean(name = INGESTION_EXECUTOR)
    public Executor ingestionExecutor() {
        return fixedPool(1, "ingestion-");
    }

    private static Executor fixedPool(int size, String prefix) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, size));
        e.setMaxPoolSize(Math.max(1, size));
        e.setThreadNamePrefix(prefix);
        e.initialize();
        return e;
    }
}
