package com.ledgerlens.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler for the pending-confirmation sweep and for every delayed re-enqueue across the five job queues
 * (retry backoff, analysis status polls). Scheduled tasks only offer a job back to its queue, so a few threads
 * are enough.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool(@Value("${ledgerlens.scheduler.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(Math.max(2, poolSize));
        s.setRemoveOnCancelPolicy(true);
        s.setThreadNamePrefix("ledgerlens-scheduler-");
        s.initialize();
        return s;
    }
}
