package com.newspulse.ingestor.source;

/**
 * Failure that retrying cannot fix, such as a rejected API key or an invalid query.
 */
public class SourceFatalException extends SourceException {

    public SourceFatalException(String message) {
        super(message);
    }

    public SourceFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
