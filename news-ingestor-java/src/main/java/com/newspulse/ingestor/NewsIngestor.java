package com.newspulse.ingestor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newspulse.ingestor.config.IngestorConfig;
import com.newspulse.ingestor.config.JsonMappers;
import com.newspulse.ingestor.processing.ArticleNormalizer;
import com.newspulse.ingestor.processing.ArticleValidator;
import com.newspulse.ingestor.retry.Sleeper;
import com.newspulse.ingestor.source.NewsApiClient;
import com.newspulse.ingestor.source.NewsApiFetchSource;
import com.newspulse.ingestor.stream.BackendConnectivityException;
import com.newspulse.ingestor.stream.KafkaStreamBackend;
import com.newspulse.ingestor.stream.KinesisStreamBackend;
import com.newspulse.ingestor.stream.StreamBackend;
import com.newspulse.ingestor.writer.ArticleRecordMapper;
import com.newspulse.ingestor.writer.BatchPacker;
import com.newspulse.ingestor.writer.BatchWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Main ingestor application that polls the news search API and streams
 * articles to Kinesis or Kafka
 */
public class NewsIngestor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NewsIngestor.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofMinutes(2);

    private final StreamBackend backend;
    private final BatchWriter writer;
    private final IngestionScheduler scheduler;

    public NewsIngestor(IngestorConfig config) {
        ObjectMapper objectMapper = JsonMappers.create();
        Clock clock = Clock.systemUTC();

        NewsApiFetchSource source = new NewsApiFetchSource(
                new NewsApiClient(objectMapper, config.getNewsApiBaseUrl(), config.getNewsApiKey()),
                config.searchQuery(),
                config.getMaxPages(),
                config.getMaxLookback(),
                config.getPageDelay(),
                config.getRetryPolicy(),
                Sleeper.SYSTEM);

        this.backend = createBackend(config);
        this.writer = new BatchWriter(
                backend,
                config.getStreamName(),
                new ArticleRecordMapper(objectMapper),
                new BatchPacker(config.getBatchMaxRecords(), config.getBatchMaxBytes(), config.getRecordMaxBytes()),
                config.getRetryPolicy(),
                Sleeper.SYSTEM,
                config.getWriterConcurrency());

        this.scheduler = new IngestionScheduler(
                source,
                new ArticleNormalizer(clock),
                new ArticleValidator(),
                writer,
                backend,
                config.getStreamName(),
                config.getLookback(),
                config.getPollInterval(),
                config.getMaxTicks(),
                clock);
    }

    private static StreamBackend createBackend(IngestorConfig config) {
        switch (config.getBackendType()) {
            case KAFKA:
                return KafkaStreamBackend.create(config.getKafkaBootstrapServers());
            case KINESIS:
            default:
                return KinesisStreamBackend.create(config.getAwsRegion(), config.getAwsEndpointUrl());
        }
    }

    /**
     * Run the ingestor until stopped
     */
    public void run() throws BackendConnectivityException {
        scheduler.run();
    }

    /**
     * Stop the ingestor, waiting for the tick in progress to drain
     */
    public void stop() {
        scheduler.stop();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT)) {
                logger.warn("Ingestor did not drain within {}s", SHUTDOWN_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        writer.close();
        backend.close();
    }

    /**
     * Main entry point
     */
    public static void main(String[] args) {
        IngestorConfig config;
        try {
            config = IngestorConfig.fromEnvironment();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        logger.info("Starting NewsIngestor with config:");
        logger.info("  Query: {} (page size {}, sort {}, language {})",
                config.getQuery(), config.getPageSize(), config.getSortBy(), config.getLanguage());
        logger.info("  Poll interval: {}s, lookback: {}h", config.getPollInterval().toSeconds(), config.getLookback().toHours());
        logger.info("  Backend: {} stream '{}'", config.getBackendType(), config.getStreamName());
        logger.info("  Batch: {} records / {} bytes, concurrency {}",
                config.getBatchMaxRecords(), config.getBatchMaxBytes(), config.getWriterConcurrency());

        int status = 0;
        try (NewsIngestor ingestor = new NewsIngestor(config)) {
            // Add shutdown hook
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                ingestor.stop();
            }));

            ingestor.run();
        } catch (BackendConnectivityException e) {
            logger.error("Failed to connect to stream. Exiting: {}", e.getMessage(), e);
            status = 1;
        } catch (RuntimeException e) {
            logger.error("Fatal error: {}", e.getMessage(), e);
            status = 1;
        }
        if (status != 0) {
            System.exit(status);
        }
    }
}
