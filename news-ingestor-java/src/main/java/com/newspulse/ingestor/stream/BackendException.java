package com.newspulse.ingestor.stream;

/**
 * A batched put failed as a whole, so no per-record results are available.
 */
public class BackendException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public BackendException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
