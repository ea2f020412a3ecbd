package com.newspulse.ingestor.processing;

/**
 * Why the normalizer could not build an article from a source record
 */
public enum SkipReason {
    MISSING_TITLE,
    MISSING_OR_MALFORMED_URL,
    MISSING_OR_MALFORMED_PUBLISHED_AT,
    REMOVED_BY_SOURCE,
    MALFORMED_RECORD
}
