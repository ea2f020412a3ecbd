package com.newspulse.ingestor.source;

import com.newspulse.ingestor.model.PollWindow;

/**
 * Single request against the news search API.
 */
public interface NewsSearchClient {

    /**
     * First page token accepted by {@link #search}
     */
    String FIRST_PAGE = "1";

    /**
     * Fetch one page of articles published inside the window.
     *
     * @throws SourceTransientException when the request may succeed if retried
     * @throws SourceFatalException     when the request will never succeed
     */
    SearchPage search(SearchQuery query, PollWindow window, String pageToken);
}
