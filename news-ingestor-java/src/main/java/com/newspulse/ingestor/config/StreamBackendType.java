package com.newspulse.ingestor.config;

public enum StreamBackendType {
    KINESIS,
    KAFKA;

    public static StreamBackendType parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("STREAM_BACKEND must be 'kinesis' or 'kafka', got '" + value + "'", e);
        }
    }
}
