package com.newspulse.ingestor.retry;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Retry state of a single operation: how many retries were used and how long
 * to wait before the next one. Holds no clock, so callers decide how to wait.
 * <p>
 * Not thread-safe; each retrying operation owns its own schedule.
 */
public final class RetrySchedule {

    private final RetryPolicy policy;
    private final IntervalFunction intervals;
    private int retries;

    RetrySchedule(RetryPolicy policy, IntervalFunction intervals) {
        this.policy = policy;
        this.intervals = intervals;
    }

    public boolean canRetry() {
        return retries < policy.getMaxRetries();
    }

    /**
     * Consume one retry and return the delay to wait before it.
     */
    public Duration nextDelay() {
        return nextDelay(null);
    }

    /**
     * Consume one retry. A server supplied hint replaces the computed backoff;
     * either way the delay never exceeds the policy's max delay.
     */
    public Duration nextDelay(Duration serverHint) {
        if (!canRetry()) {
            throw new IllegalStateException("Retry budget exhausted after " + retries + " retries");
        }
        retries++;
        long millis = serverHint != null && !serverHint.isNegative()
                ? serverHint.toMillis()
                : intervals.apply(retries);
        return Duration.ofMillis(Math.min(millis, policy.getMaxDelay().toMillis()));
    }

    public int retries() {
        return retries;
    }

    public int maxRetries() {
        return policy.getMaxRetries();
    }
}
