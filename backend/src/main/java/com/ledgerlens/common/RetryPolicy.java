package com.ledgerlens.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional ± jitter for job retries and model-call retries.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before the retry that follows the given one-based failed attempt.
     * Formula: baseDelay * 2^(attempt-1), then ± jitter.
     */
    public long delayMs(int failedAttempt) {
        if (failedAttempt <= 1) {
            return jitter(baseDelayMs);
        }
        long exponential = baseDelayMs * (1L << Math.min(failedAttempt - 1, 20));
        return jitter(exponential);
    }

    /** True when another attempt is allowed after {@code attemptsMade} attempts. */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    /**
     * Default job policy: 2s base, no jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(2000L, 0.0, 3);
    }
}
