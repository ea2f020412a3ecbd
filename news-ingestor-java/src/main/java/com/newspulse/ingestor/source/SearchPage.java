package com.newspulse.ingestor.source;

import com.newspulse.ingestor.model.RawArticle;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * One page of search results.
 * {@code nextPageToken} is null when the source has no further pages.
 * {@code malformed} counts entries on the page that could not be read as an article.
 */
@Value
@AllArgsConstructor
public class SearchPage {

    List<RawArticle> articles;
    int totalResults;
    String nextPageToken;
    int malformed;

    public SearchPage(List<RawArticle> articles, int totalResults, String nextPageToken) {
        this(articles, totalResults, nextPageToken, 0);
    }

    public static SearchPage last(List<RawArticle> articles, int totalResults) {
        return new SearchPage(articles, totalResults, null);
    }

    public boolean hasNext() {
        return nextPageToken != null;
    }
}
