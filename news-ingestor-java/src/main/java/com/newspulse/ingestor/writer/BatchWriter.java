package com.newspulse.ingestor.writer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.newspulse.ingestor.model.Article;
import com.newspulse.ingestor.retry.RetryPolicy;
import com.newspulse.ingestor.retry.RetrySchedule;
import com.newspulse.ingestor.retry.Sleeper;
import com.newspulse.ingestor.stream.BackendException;
import com.newspulse.ingestor.stream.PutRecordResult;
import com.newspulse.ingestor.stream.StreamBackend;
import com.newspulse.ingestor.stream.StreamRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes articles to the stream in bounded batches.
 * <p>
 * Batches are submitted concurrently on a fixed pool. When the backend accepts
 * only part of a batch, the records that failed with a retryable code are
 * repacked into a smaller batch and resent after a backoff, up to the retry
 * ceiling. Non-retryable failures are dropped straight away. Each batch keeps
 * its own retry state, so a backoff only delays that batch.
 */
public class BatchWriter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchWriter.class);

    static final String CODE_RECORD_TOO_LARGE = "RecordTooLarge";
    static final String CODE_SERIALIZATION = "SerializationFailed";
    static final String CODE_RESULT_MISMATCH = "ResultCountMismatch";
    static final String CODE_INTERRUPTED = "Interrupted";

    private final StreamBackend backend;
    private final String streamName;
    private final ArticleRecordMapper recordMapper;
    private final BatchPacker packer;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final ExecutorService executor;

    public BatchWriter(
            StreamBackend backend,
            String streamName,
            ArticleRecordMapper recordMapper,
            BatchPacker packer,
            RetryPolicy retryPolicy,
            Sleeper sleeper,
            int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
        this.backend = backend;
        this.streamName = streamName;
        this.recordMapper = recordMapper;
        this.packer = packer;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.executor = Executors.newFixedThreadPool(concurrency, namedThreads());
    }

    /**
     * Write all articles and wait for every batch, including retries, to finish.
     */
    public WriteReport write(List<Article> articles) {
        if (articles.isEmpty()) {
            return WriteReport.empty();
        }
        WriteReport.Accumulator report = new WriteReport.Accumulator().submitted(articles.size());

        List<StreamRecord> records = new ArrayList<>(articles.size());
        for (Article article : articles) {
            try {
                records.add(recordMapper.toRecord(article));
            } catch (JsonProcessingException e) {
                report.dropped(drop(article.getId(), DropStage.SERIALIZATION, CODE_SERIALIZATION, e.getMessage(), 0));
            }
        }

        BatchPacker.Packing packing = packer.pack(records);
        for (StreamRecord record : packing.getOversized()) {
            report.dropped(drop(record.getPartitionKey(), DropStage.PACKING, CODE_RECORD_TOO_LARGE,
                    record.sizeInBytes() + " bytes exceeds the " + packer.getMaxRecordBytes() + " byte record limit", 0));
        }

        List<Batch> batches = packing.getBatches();
        logger.info("Writing {} records to '{}' in {} batches", records.size() - packing.getOversized().size(),
                streamName, batches.size());

        List<Future<BatchOutcome>> futures = new ArrayList<>(batches.size());
        for (Batch batch : batches) {
            futures.add(executor.submit(() -> submit(batch)));
        }
        for (int i = 0; i < futures.size(); i++) {
            report.merge(await(futures.get(i), batches.get(i)));
        }

        WriteReport result = report.build();
        logger.info("Write finished: submitted={}, succeeded={}, retried={}, dropped={}",
                result.getSubmitted(), result.getSucceeded(), result.getRetried(), result.getPermanentlyDropped());
        return result;
    }

    /**
     * Submit one batch, resubmitting its retryable failures until they succeed
     * or the retry budget runs out.
     */
    BatchOutcome submit(Batch batch) {
        RetrySchedule schedule = retryPolicy.newSchedule();
        List<Pending> pending = new ArrayList<>(batch.size());
        for (StreamRecord record : batch.getRecords()) {
            pending.add(new Pending(record));
        }

        int succeeded = 0;
        int retried = 0;
        List<DroppedRecord> dropped = new ArrayList<>();

        while (true) {
            List<Pending> retry = new ArrayList<>();
            List<PutRecordResult> results = null;
            try {
                results = backend.putRecords(streamName, records(pending));
                if (results == null || results.size() != pending.size()) {
                    throw new BackendException(CODE_RESULT_MISMATCH,
                            "Backend returned " + (results == null ? 0 : results.size()) + " results for "
                                    + pending.size() + " records",
                            true, null);
                }
            } catch (BackendException e) {
                results = null;
                for (Pending record : pending) {
                    if (e.isRetryable()) {
                        retry.add(record.failed(e.getErrorCode(), e.getMessage()));
                    } else {
                        dropped.add(drop(record.key(), DropStage.BACKEND, e.getErrorCode(), e.getMessage(),
                                schedule.retries()));
                    }
                }
            } catch (RuntimeException e) {
                // unclassified failure: drop what is still pending, keep earlier outcomes
                results = null;
                logger.error("Unexpected error writing {} records to '{}': {}", pending.size(), streamName,
                        e.getMessage(), e);
                for (Pending record : pending) {
                    dropped.add(drop(record.key(), DropStage.BACKEND, e.getClass().getSimpleName(), e.getMessage(),
                            schedule.retries()));
                }
            }

            if (results != null) {
                for (int i = 0; i < results.size(); i++) {
                    PutRecordResult result = results.get(i);
                    Pending record = pending.get(i);
                    if (result == null) {
                        retry.add(record.failed(CODE_RESULT_MISMATCH, "No result returned for record"));
                    } else if (result.isSuccess()) {
                        succeeded++;
                    } else if (result.isRetryable()) {
                        retry.add(record.failed(result.getErrorCode(), result.getErrorMessage()));
                    } else {
                        dropped.add(drop(record.key(), DropStage.BACKEND, result.getErrorCode(),
                                result.getErrorMessage(), schedule.retries()));
                    }
                }
            }

            if (retry.isEmpty()) {
                break;
            }
            if (!schedule.canRetry()) {
                for (Pending record : retry) {
                    dropped.add(drop(record.key(), DropStage.BACKEND, record.errorCode, record.errorMessage,
                            schedule.retries()));
                }
                break;
            }

            Duration delay = schedule.nextDelay();
            logger.warn("Retrying {} of {} records (retry {}/{} in {}ms), last error {}",
                    retry.size(), pending.size(), schedule.retries(), schedule.maxRetries(), delay.toMillis(),
                    retry.get(0).errorCode);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (Pending record : retry) {
                    dropped.add(drop(record.key(), DropStage.BACKEND, CODE_INTERRUPTED,
                            "Interrupted before retry, last error " + record.errorCode, schedule.retries() - 1));
                }
                break;
            }
            retried += retry.size();
            pending = retry;
        }
        return new BatchOutcome(succeeded, retried, dropped);
    }

    private BatchOutcome await(Future<BatchOutcome> future, Batch batch) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    // the submission keeps running on the pool, so wait for its outcome
                    interrupted = true;
                } catch (ExecutionException e) {
                    logger.error("Batch submission failed unexpectedly: {}", e.getCause().getMessage(), e.getCause());
                    return failedBatch(batch, e.getCause());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private BatchOutcome failedBatch(Batch batch, Throwable cause) {
        List<DroppedRecord> dropped = new ArrayList<>(batch.size());
        for (StreamRecord record : batch.getRecords()) {
            dropped.add(drop(record.getPartitionKey(), DropStage.BACKEND, cause.getClass().getSimpleName(),
                    cause.getMessage(), 0));
        }
        return new BatchOutcome(0, 0, dropped);
    }

    private static DroppedRecord drop(String articleId, DropStage stage, String code, String message, int retries) {
        logger.warn("Dropping record article_id={} stage={} code={} retries={}: {}",
                articleId, stage, code, retries, message);
        return new DroppedRecord(articleId, stage, code, message, retries);
    }

    private static List<StreamRecord> records(List<Pending> pending) {
        List<StreamRecord> records = new ArrayList<>(pending.size());
        for (Pending p : pending) {
            records.add(p.record);
        }
        return records;
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "batch-writer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Batch writer pool did not terminate within 30s");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * A record awaiting (re)submission and the error it last failed with
     */
    private static final class Pending {
        private final StreamRecord record;
        private String errorCode;
        private String errorMessage;

        Pending(StreamRecord record) {
            this.record = record;
        }

        Pending failed(String code, String message) {
            this.errorCode = code;
            this.errorMessage = message;
            return this;
        }

        String key() {
            return record.getPartitionKey();
        }
    }
}
