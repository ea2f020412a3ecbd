package com.newspulse.ingestor;

/**
 * Phases of the ingestion loop. {@code STOPPED} is reached only on cancellation
 * or a failed startup check.
 */
public enum SchedulerState {
    IDLE,
    FETCHING,
    PROCESSING,
    WRITING,
    SLEEPING,
    STOPPED
}
