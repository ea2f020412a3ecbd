package com.newspulse.ingestor.source;

import java.time.Duration;

/**
 * Failure that may succeed when retried: server errors, IO failures and rate limiting.
 */
public class SourceTransientException extends SourceException {

    private final Duration retryAfter;

    public SourceTransientException(String message) {
        this(message, null, null);
    }

    public SourceTransientException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public SourceTransientException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    /**
     * Server supplied wait before the next attempt, or null when none was sent
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
