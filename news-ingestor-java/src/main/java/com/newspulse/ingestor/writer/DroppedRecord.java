package com.newspulse.ingestor.writer;

import lombok.Value;

/**
 * Audit entry for a record that was never written.
 * {@code retries} is how many times the record was resubmitted before giving up.
 */
@Value
public class DroppedRecord {

    String articleId;
    DropStage stage;
    String errorCode;
    String message;
    int retries;
}
