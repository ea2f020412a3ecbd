package com.newspulse.ingestor.stream;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Backend outcome for a single record of a batched put.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PutRecordResult {

    boolean success;
    String recordId;
    String errorCode;
    String errorMessage;
    boolean retryable;

    public static PutRecordResult ok(String recordId) {
        return new PutRecordResult(true, recordId, null, null, false);
    }

    public static PutRecordResult retryableFailure(String errorCode, String errorMessage) {
        return new PutRecordResult(false, null, errorCode, errorMessage, true);
    }

    public static PutRecordResult permanentFailure(String errorCode, String errorMessage) {
        return new PutRecordResult(false, null, errorCode, errorMessage, false);
    }
}
