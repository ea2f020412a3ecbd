package com.newspulse.ingestor.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time range {@code [from, to)} searched on one scheduler tick.
 */
@Value
public class PollWindow {

    Instant from;
    Instant to;

    public static PollWindow endingAt(Instant now, Duration lookback) {
        if (lookback.isNegative() || lookback.isZero()) {
            throw new IllegalArgumentException("lookback must be positive: " + lookback);
        }
        return new PollWindow(now.minus(lookback), now);
    }

    public Duration length() {
        return Duration.between(from, to);
    }
}
