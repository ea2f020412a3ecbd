package com.newspulse.ingestor.source;

import lombok.Builder;
import lombok.Value;

/**
 * Search parameters that stay fixed across ticks
 */
@Value
@Builder
public class SearchQuery {

    String query;

    @Builder.Default
    int pageSize = 100;

    @Builder.Default
    String sortBy = "publishedAt";

    @Builder.Default
    String language = "en";
}
