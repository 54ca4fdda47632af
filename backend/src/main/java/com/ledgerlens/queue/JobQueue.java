package com.ledgerlens.queue;

import com.ledgerlens.common.RetryPolicy;
import com.ledgerlens.queue.job.Job;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process job queue: priority-ordered waiting set, a fixed number of worker loops on a dedicated executor,
 * retry with exponential backoff through the scheduler, and bounded history of finished jobs.
 */
@Slf4j
public class JobQueue<J extends Job> {

    private record Entry<J>(J job, int attempt, long sequence) {}

    private final String name;
    private final int workers;
    private final Executor executor;
    private final TaskScheduler scheduler;
    private final RetryPolicy retryPolicy;
    private final int keepCompleted;
    private final int keepFailed;
    private final Clock clock;

    private final AtomicLong sequence = new AtomicLong();
    private final PriorityBlockingQueue<Entry<J>> waiting = new PriorityBlockingQueue<>(16, (a, b) -> {
        int byPriority = Integer.compare(b.job().priority(), a.job().priority());
        return byPriority != 0 ? byPriority : Long.compare(a.sequence(), b.sequence());
    });
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger delayed = new AtomicInteger();
    private final Deque<JobRecord> completed = new ConcurrentLinkedDeque<>();
    private final Deque<JobRecord> failed = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean workersStarted = new AtomicBoolean(false);

    public JobQueue(String name, int workers, Executor executor, TaskScheduler scheduler, RetryPolicy retryPolicy,
                    int keepCompleted, int keepFailed, Clock clock) {
        this.name = name;
        this.workers = workers;
        this.executor = executor;
        this.scheduler = scheduler;
        this.retryPolicy = retryPolicy;
        this.keepCompleted = keepCompleted;
        this.keepFailed = keepFailed;
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    public void add(J job) {
        waiting.offer(new Entry<>(job, 1, sequence.incrementAndGet()));
        log.debug("Job {} added to {} (priority {})", job.jobId(), name, job.priority());
    }

    /** Enqueues the job after {@code delayMs}; used for polling and retry backoff. */
    public void addDelayed(J job, long delayMs) {
        schedule(new Entry<>(job, 1, sequence.incrementAndGet()), delayMs);
    }

    /** Starts the worker loops once; later calls are ignored. */
    public void start(JobHandler<J> handler) {
        if (!workersStarted.compareAndSet(false, true)) {
            return;
        }
        int n = Math.max(1, workers);
        for (int i = 0; i < n; i++) {
            executor.execute(() -> workerLoop(handler));
        }
        log.info("Queue {} worker loops started: {}", name, n);
    }

    public QueueStats stats() {
        return new QueueStats(name, waiting.size(), active.get(), delayed.get(), completed.size(), failed.size());
    }

    public List<JobRecord> recentFailures() {
        return new ArrayList<>(failed);
    }

    public List<JobRecord> recentCompletions() {
        return new ArrayList<>(completed);
    }

    private void workerLoop(JobHandler<J> handler) {
        while (true) {
            try {
                Entry<J> entry = waiting.take();
                active.incrementAndGet();
                try {
                    runAttempt(entry, handler);
                } finally {
                    active.decrementAndGet();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Queue {} worker interrupted", name);
                break;
            }
        }
    }

    private void runAttempt(Entry<J> entry, JobHandler<J> handler) {
        J job = entry.job();
        try {
            handler.handle(job);
            remember(completed, new JobRecord(job.jobId(), entry.attempt(), Instant.now(clock), null), keepCompleted);
            log.info("Job {} on {} completed (attempt {})", job.jobId(), name, entry.attempt());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (retryPolicy.canRetry(entry.attempt()) && !Thread.currentThread().isInterrupted()) {
                long delay = retryPolicy.delayMs(entry.attempt());
                log.warn("Job {} on {} failed (attempt {}/{}), retrying in {} ms: {}", job.jobId(), name,
                        entry.attempt(), retryPolicy.getMaxAttempts(), delay, e.getMessage());
                schedule(new Entry<>(job, entry.attempt() + 1, entry.sequence()), delay);
                return;
            }
            log.error("Job {} on {} failed after {} attempt(s): {}", job.jobId(), name, entry.attempt(),
                    e.getMessage(), e);
            remember(failed, new JobRecord(job.jobId(), entry.attempt(), Instant.now(clock), e.getMessage()),
                    keepFailed);
            try {
                handler.onExhausted(job, e);
            } catch (RuntimeException hookError) {
                log.error("Exhaustion hook for job {} on {} failed: {}", job.jobId(), name,
                        hookError.getMessage(), hookError);
            }
        }
    }

    private void schedule(Entry<J> entry, long delayMs) {
        delayed.incrementAndGet();
        scheduler.schedule(() -> {
            delayed.decrementAndGet();
            waiting.offer(entry);
        }, Instant.now(clock).plusMillis(Math.max(0, delayMs)));
    }

    private static void remember(Deque<JobRecord> history, JobRecord record, int keep) {
        history.addFirst(record);
        while (history.size() > keep) {
            history.pollLast();
        }
    }
}
