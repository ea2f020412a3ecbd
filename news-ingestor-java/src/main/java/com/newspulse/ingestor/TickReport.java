package com.newspulse.ingestor;

import com.newspulse.ingestor.model.PollWindow;
import com.newspulse.ingestor.processing.SkipReason;
import com.newspulse.ingestor.processing.ValidationError;
import com.newspulse.ingestor.writer.WriteReport;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Summary of one poll cycle.
 * {@code failure} is set when the tick was abandoned before writing.
 */
@Value
@Builder
public class TickReport {

    long tick;
    PollWindow window;
    int fetched;
    int valid;
    int duplicates;
    Map<SkipReason, Integer> skipped;
    Map<ValidationError, Integer> invalid;
    WriteReport writeReport;
    String failure;
    Instant startedAt;
    Instant finishedAt;

    public boolean isFailed() {
        return failure != null;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }
}
