package com.newspulse.ingestor.processing;

/**
 * First rule an article failed in {@link ArticleValidator}
 */
public enum ValidationError {
    MISSING_TITLE,
    MISSING_OR_MALFORMED_URL,
    MISSING_OR_MALFORMED_PUBLISHED_AT
}
