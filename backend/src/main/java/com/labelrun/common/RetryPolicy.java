package com.labelrun.common;

import io.github.resilience4j.core.IntervalFunction;

/**
 * Exponential backoff for classification-service retries: baseDelay * 2^attempt, optional ± jitter.
 */
public final class RetryPolicy {

    private static final double MULTIPLIER = 2.0;

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxRetries;
    private final IntervalFunction intervals;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxRetries) {
        if (baseDelayMs < 1) {
            throw new IllegalArgumentException("baseDelayMs must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (jitterFactor < 0 || jitterFactor >= 1) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxRetries = maxRetries;
        this.intervals = jitterFactor > 0
                ? IntervalFunction.ofExponentialRandomBackoff(baseDelayMs, MULTIPLIER, jitterFactor)
                : IntervalFunction.ofExponentialBackoff(baseDelayMs, MULTIPLIER);
    }

    /**
     * Delay in milliseconds to wait after the given zero-based failed attempt.
     */
    public long delayMs(int attempt) {
        // IntervalFunction counts attempts from 1
        return intervals.apply(Math.max(0, Math.min(attempt, 20)) + 1);
    }

    /** Retries after the initial call. */
    public int getMaxRetries() {
        return maxRetries;
    }

    /** Initial call plus retries. */
    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    /**
     * Default: 2s base, no jitter, 3 retries.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(2000L, 0.0, 3);
    }
}
