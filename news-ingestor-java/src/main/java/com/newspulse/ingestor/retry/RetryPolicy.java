package com.newspulse.ingestor.retry;

import io.github.resilience4j.core.IntervalFunction;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff settings shared by the source and the stream writer.
 * <p>
 * {@code maxRetries} counts resubmissions after the first attempt, so an
 * operation runs at most {@code maxRetries + 1} times.
 */
@Value
@Builder
public class RetryPolicy {

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofMillis(500);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    @Builder.Default
    double multiplier = 2.0;

    /**
     * Fraction of each delay that is randomized, in {@code [0, 1)}
     */
    @Builder.Default
    double jitterFactor = 0.5;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public RetrySchedule newSchedule() {
        return new RetrySchedule(this, intervalFunction());
    }

    private IntervalFunction intervalFunction() {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (jitterFactor > 0) {
            return IntervalFunction.ofExponentialRandomBackoff(initialDelay, multiplier, jitterFactor);
        }
        return IntervalFunction.ofExponentialBackoff(initialDelay, multiplier);
    }
}
