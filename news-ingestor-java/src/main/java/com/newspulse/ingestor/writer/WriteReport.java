package com.newspulse.ingestor.writer;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one {@link BatchWriter#write} call.
 * <p>
 * Every submitted record is either succeeded or permanently dropped;
 * {@code retried} counts record resubmissions across all attempts.
 */
@Value
public class WriteReport {

    int submitted;
    int succeeded;
    int retried;
    List<DroppedRecord> dropped;

    public static WriteReport empty() {
        return new WriteReport(0, 0, 0, List.of());
    }

    public int getPermanentlyDropped() {
        return dropped.size();
    }

    /**
     * Accumulates partial outcomes from concurrent batch submissions
     */
    static class Accumulator {
        private int submitted;
        private int succeeded;
        private int retried;
        private final List<DroppedRecord> dropped = new ArrayList<>();

        Accumulator submitted(int count) {
            submitted += count;
            return this;
        }

        Accumulator dropped(DroppedRecord record) {
            dropped.add(record);
            return this;
        }

        Accumulator merge(BatchOutcome outcome) {
            succeeded += outcome.getSucceeded();
            retried += outcome.getRetried();
            dropped.addAll(outcome.getDropped());
            return this;
        }

        WriteReport build() {
            return new WriteReport(submitted, succeeded, retried, List.copyOf(dropped));
        }
    }
}
