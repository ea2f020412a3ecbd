package com.newspulse.ingestor.source;

/**
 * Failure talking to the news search API
 */
public abstract class SourceException extends RuntimeException {

    protected SourceException(String message) {
        super(message);
    }

    protected SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
