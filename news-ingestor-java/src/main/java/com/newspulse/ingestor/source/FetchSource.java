package com.newspulse.ingestor.source;

import com.newspulse.ingestor.model.PollWindow;

import java.util.Iterator;

/**
 * Produces the pages of source articles for a poll window.
 * <p>
 * The returned iterator is lazy: each {@code next()} performs the request for one
 * page and may throw a {@link SourceException}. Every call to {@link #fetch}
 * starts again from the first page.
 */
public interface FetchSource {

    Iterator<SearchPage> fetch(PollWindow window);
}
