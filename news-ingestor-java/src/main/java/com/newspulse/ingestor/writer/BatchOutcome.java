package com.newspulse.ingestor.writer;

import lombok.Value;

import java.util.List;

/**
 * Result of submitting one packed batch, including its retries
 */
@Value
class BatchOutcome {

    int succeeded;
    int retried;
    List<DroppedRecord> dropped;
}
