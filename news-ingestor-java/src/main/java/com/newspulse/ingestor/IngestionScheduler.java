package com.newspulse.ingestor;

import com.newspulse.ingestor.model.Article;
import com.newspulse.ingestor.model.PollWindow;
import com.newspulse.ingestor.model.RawArticle;
import com.newspulse.ingestor.processing.ArticleNormalizer;
import com.newspulse.ingestor.processing.ArticleValidator;
import com.newspulse.ingestor.processing.NormalizationResult;
import com.newspulse.ingestor.processing.SkipReason;
import com.newspulse.ingestor.processing.ValidationError;
import com.newspulse.ingestor.processing.ValidationResult;
import com.newspulse.ingestor.source.FetchSource;
import com.newspulse.ingestor.source.SearchPage;
import com.newspulse.ingestor.source.SourceException;
import com.newspulse.ingestor.source.SourceFatalException;
import com.newspulse.ingestor.stream.BackendConnectivityException;
import com.newspulse.ingestor.stream.StreamBackend;
import com.newspulse.ingestor.writer.BatchWriter;
import com.newspulse.ingestor.writer.WriteReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Drives the fetch, normalize, validate, write cycle at a fixed interval.
 * <p>
 * Ticks run one at a time on the thread that calls {@link #run()}. A failed
 * tick is logged and the loop carries on after the usual sleep; only the
 * startup connectivity check can end the loop with an error. {@link #stop()}
 * lets the current tick drain and then ends the loop without starting another.
 */
public class IngestionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(IngestionScheduler.class);

    private static final int PREVIEW_ARTICLES = 20;
    private static final int PREVIEW_CONTENT_LENGTH = 200;

    private final FetchSource source;
    private final ArticleNormalizer normalizer;
    private final ArticleValidator validator;
    private final BatchWriter writer;
    private final StreamBackend backend;
    private final String streamName;
    private final Duration lookback;
    private final Duration pollInterval;
    private final int maxTicks;
    private final Clock clock;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile SchedulerState state = SchedulerState.IDLE;
    private volatile TickReport lastReport;
    private long ticks;

    public IngestionScheduler(
            FetchSource source,
            ArticleNormalizer normalizer,
            ArticleValidator validator,
            BatchWriter writer,
            StreamBackend backend,
            String streamName,
            Duration lookback,
            Duration pollInterval,
            int maxTicks,
            Clock clock) {
        this.source = source;
        this.normalizer = normalizer;
        this.validator = validator;
        this.writer = writer;
        this.backend = backend;
        this.streamName = streamName;
        this.lookback = lookback;
        this.pollInterval = pollInterval;
        this.maxTicks = maxTicks;
        this.clock = clock;
    }

    /**
     * Check backend connectivity, then poll until stopped or until
     * {@code maxTicks} ticks have run (0 means no limit).
     *
     * @throws BackendConnectivityException if the stream cannot be written
     */
    public void run() throws BackendConnectivityException {
        try {
            logger.info("Testing connection to stream '{}'...", streamName);
            backend.checkConnectivity(streamName);

            logger.info("Starting scheduler with {}s interval, {}h lookback",
                    pollInterval.toSeconds(), lookback.toHours());

            while (!isStopRequested()) {
                lastReport = runTick();

                if (maxTicks > 0 && ticks >= maxTicks) {
                    logger.info("Reached max ticks ({}), stopping", maxTicks);
                    break;
                }

                transition(SchedulerState.SLEEPING);
                logger.info("Waiting {} seconds until next tick", pollInterval.toSeconds());
                if (stopSignal.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            logger.info("Scheduler interrupted, stopping");
            Thread.currentThread().interrupt();
        } finally {
            transition(SchedulerState.STOPPED);
            terminated.countDown();
            logger.info("Scheduler stopped after {} ticks", ticks);
        }
    }

    /**
     * Run a single poll cycle. Never throws; failures are recorded in the report.
     */
    TickReport runTick() {
        long tick = ++ticks;
        Instant startedAt = clock.instant();
        TickReport.TickReportBuilder report = TickReport.builder()
                .tick(tick)
                .startedAt(startedAt)
                .skipped(Map.of())
                .invalid(Map.of())
                .writeReport(WriteReport.empty());

        try {
            logger.info("Starting tick {} at {}", tick, startedAt);

            transition(SchedulerState.FETCHING);
            PollWindow window = PollWindow.endingAt(startedAt, lookback);
            report.window(window);
            Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
            List<RawArticle> raw = fetchAll(window, skipped);
            report.fetched(raw.size() + skipped.getOrDefault(SkipReason.MALFORMED_RECORD, 0));

            transition(SchedulerState.PROCESSING);
            List<Article> valid = process(raw, skipped, report);
            report.valid(valid.size());

            if (valid.isEmpty()) {
                logger.warn("No valid articles in tick {}", tick);
            } else {
                logPreview(valid);
                transition(SchedulerState.WRITING);
                report.writeReport(writer.write(valid));
            }
        } catch (SourceFatalException e) {
            logger.error("Tick {} aborted, source rejected the request: {}", tick, e.getMessage());
            report.failure(e.getMessage());
        } catch (SourceException e) {
            logger.error("Tick {} aborted, source unavailable after retries: {}", tick, e.getMessage());
            report.failure(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error in tick {}: {}", tick, e.getMessage(), e);
            report.failure(e.toString());
        }

        TickReport result = report.finishedAt(clock.instant()).build();
        logSummary(result);
        return result;
    }

    /**
     * Collect the articles of every page, tallying unreadable entries as malformed skips
     */
    private List<RawArticle> fetchAll(PollWindow window, Map<SkipReason, Integer> skipped) {
        List<RawArticle> raw = new ArrayList<>();
        Iterator<SearchPage> pages = source.fetch(window);
        while (pages.hasNext()) {
            SearchPage page = pages.next();
            raw.addAll(page.getArticles());
            if (page.getMalformed() > 0) {
                skipped.merge(SkipReason.MALFORMED_RECORD, page.getMalformed(), Integer::sum);
            }
        }
        logger.info("Total articles fetched: {}", raw.size());
        return raw;
    }

    /**
     * Normalize and validate, dropping skipped, invalid and repeated articles
     */
    private List<Article> process(List<RawArticle> raw, Map<SkipReason, Integer> skipped,
                                  TickReport.TickReportBuilder report) {
        Map<ValidationError, Integer> invalid = new EnumMap<>(ValidationError.class);
        Map<String, Article> unique = new LinkedHashMap<>();
        int duplicates = 0;

        for (RawArticle article : raw) {
            NormalizationResult normalized = normalizer.normalize(article);
            if (normalized.isSkipped()) {
                logger.warn("Skipping article ({}): {}", normalized.getSkipReason(), normalized.getDetail());
                skipped.merge(normalized.getSkipReason(), 1, Integer::sum);
                continue;
            }
            ValidationResult validation = validator.validate(normalized.getArticle());
            if (!validation.isValid()) {
                logger.warn("Invalid article article_id={} ({}): url={}", normalized.getArticle().getId(),
                        validation.getError(), normalized.getArticle().getUrl());
                invalid.merge(validation.getError(), 1, Integer::sum);
                continue;
            }
            Article valid = validation.getArticle();
            if (unique.putIfAbsent(valid.getId(), valid) != null) {
                duplicates++;
            }
        }

        report.skipped(Collections.unmodifiableMap(skipped))
                .invalid(Collections.unmodifiableMap(invalid))
                .duplicates(duplicates);
        logger.info("Processed {}/{} articles", unique.size(), raw.size());
        return new ArrayList<>(unique.values());
    }

    private void logPreview(List<Article> articles) {
        logger.info("News data received:");
        int shown = Math.min(articles.size(), PREVIEW_ARTICLES);
        for (int i = 0; i < shown; i++) {
            Article article = articles.get(i);
            String content = article.getContent().isEmpty() ? "(no content)" : article.getContent();
            if (content.length() > PREVIEW_CONTENT_LENGTH) {
                content = content.substring(0, PREVIEW_CONTENT_LENGTH) + "...";
            }
            logger.info("  [{}] {}", i + 1, article.getTitle());
            logger.info("      source: {} | published: {}", article.getSourceName(), article.getPublishedAt());
            logger.info("      url: {}", article.getUrl());
            logger.info("      content: {}", content);
        }
        if (articles.size() > shown) {
            logger.info("  ... and {} more articles", articles.size() - shown);
        }
    }

    private void logSummary(TickReport report) {
        WriteReport write = report.getWriteReport();
        logger.info("Tick {} completed in {}ms: fetched={}, valid={}, duplicates={}, skipped={}, invalid={}, "
                        + "succeeded={}, retried={}, dropped={}{}",
                report.getTick(), report.elapsed().toMillis(), report.getFetched(), report.getValid(),
                report.getDuplicates(), report.getSkipped(), report.getInvalid(), write.getSucceeded(),
                write.getRetried(), write.getPermanentlyDropped(),
                report.isFailed() ? ", failure=" + report.getFailure() : "");
    }

    private void transition(SchedulerState next) {
        logger.debug("Scheduler state {} -> {}", state, next);
        state = next;
    }

    /**
     * Request a graceful stop. The tick in progress, including its write
     * retries, completes first.
     */
    public void stop() {
        logger.info("Stop requested");
        stopSignal.countDown();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    public SchedulerState getState() {
        return state;
    }

    public TickReport getLastReport() {
        return lastReport;
    }
}
