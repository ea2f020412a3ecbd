package com.newspulse.ingestor.stream;

/**
 * The stream cannot be reached or written with the configured credentials.
 */
public class BackendConnectivityException extends Exception {

    public BackendConnectivityException(String message) {
        super(message);
    }

    public BackendConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
