package com.newspulse.ingestor.source;

import com.newspulse.ingestor.model.PollWindow;
import com.newspulse.ingestor.retry.RetryPolicy;
import com.newspulse.ingestor.retry.RetrySchedule;
import com.newspulse.ingestor.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Paginates a {@link NewsSearchClient} over a poll window, retrying transient
 * failures of each page request with exponential backoff.
 */
public class NewsApiFetchSource implements FetchSource {

    private static final Logger logger = LoggerFactory.getLogger(NewsApiFetchSource.class);

    private final NewsSearchClient client;
    private final SearchQuery query;
    private final int maxPages;
    private final Duration maxLookback;
    private final Duration pageDelay;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public NewsApiFetchSource(
            NewsSearchClient client,
            SearchQuery query,
            int maxPages,
            Duration maxLookback,
            Duration pageDelay,
            RetryPolicy retryPolicy,
            Sleeper sleeper) {
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be at least 1: " + maxPages);
        }
        this.client = client;
        this.query = query;
        this.maxPages = maxPages;
        this.maxLookback = maxLookback;
        this.pageDelay = pageDelay;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    @Override
    public Iterator<SearchPage> fetch(PollWindow window) {
        if (window.length().compareTo(maxLookback) > 0) {
            throw new SourceFatalException("Lookback window " + window.length()
                    + " exceeds the source's maximum query range " + maxLookback);
        }
        return new PageIterator(window);
    }

    private SearchPage fetchWithRetry(PollWindow window, String pageToken) {
        RetrySchedule schedule = retryPolicy.newSchedule();
        while (true) {
            try {
                return client.search(query, window, pageToken);
            } catch (SourceTransientException e) {
                if (!schedule.canRetry()) {
                    logger.error("Giving up on page {} after {} retries: {}",
                            pageToken, schedule.retries(), e.getMessage());
                    throw e;
                }
                Duration delay = schedule.nextDelay(e.getRetryAfter());
                logger.warn("Transient error fetching page {} (retry {}/{} in {}ms): {}",
                        pageToken, schedule.retries(), schedule.maxRetries(), delay.toMillis(), e.getMessage());
                pause(delay);
            }
        }
    }

    private void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceTransientException("Interrupted while waiting to fetch the next page", e);
        }
    }

    /**
     * Lazily requests one page per {@code next()} call
     */
    private class PageIterator implements Iterator<SearchPage> {

        private final PollWindow window;
        private String nextToken = NewsSearchClient.FIRST_PAGE;
        private int pagesFetched;

        PageIterator(PollWindow window) {
            this.window = window;
        }

        @Override
        public boolean hasNext() {
            if (nextToken != null && pagesFetched >= maxPages) {
                logger.info("Stopping after {} pages (page ceiling)", pagesFetched);
                nextToken = null;
            }
            return nextToken != null;
        }

        @Override
        public SearchPage next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            if (pagesFetched > 0) {
                pause(pageDelay);
            }
            SearchPage page = fetchWithRetry(window, nextToken);
            pagesFetched++;
            boolean empty = page.getArticles().isEmpty() && page.getMalformed() == 0;
            nextToken = empty ? null : page.getNextPageToken();
            return page;
        }
    }
}
