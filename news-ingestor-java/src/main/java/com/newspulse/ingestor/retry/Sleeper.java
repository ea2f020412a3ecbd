package com.newspulse.ingestor.retry;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts.
 * Tests substitute an implementation that records delays instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
