package com.newspulse.ingestor.config;

import com.newspulse.ingestor.retry.RetryPolicy;
import com.newspulse.ingestor.source.NewsApiClient;
import com.newspulse.ingestor.source.SearchQuery;
import com.newspulse.ingestor.writer.BatchPacker;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Validated settings for one ingestor process, read from environment variables
 */
@Value
@Builder
public class IngestorConfig {

    // News search API
    String newsApiKey;
    @Builder.Default
    String newsApiBaseUrl = NewsApiClient.DEFAULT_BASE_URL;
    @Builder.Default
    String query = "technology";
    @Builder.Default
    int pageSize = 100;
    @Builder.Default
    String sortBy = "publishedAt";
    @Builder.Default
    String language = "en";
    @Builder.Default
    int maxPages = 5;
    @Builder.Default
    Duration pageDelay = Duration.ofSeconds(1);
    @Builder.Default
    Duration maxLookback = Duration.ofDays(30);

    // Scheduling
    @Builder.Default
    Duration lookback = Duration.ofHours(24);
    @Builder.Default
    Duration pollInterval = Duration.ofMinutes(5);
    @Builder.Default
    int maxTicks = 0;

    // Stream backend
    @Builder.Default
    StreamBackendType backendType = StreamBackendType.KINESIS;
    @Builder.Default
    String streamName = "news-ingest-stream";
    @Builder.Default
    String awsRegion = "us-east-1";
    String awsEndpointUrl;
    @Builder.Default
    String kafkaBootstrapServers = "localhost:9092";

    // Batching
    @Builder.Default
    int batchMaxRecords = BatchPacker.DEFAULT_MAX_RECORDS;
    @Builder.Default
    long batchMaxBytes = BatchPacker.DEFAULT_MAX_BATCH_BYTES;
    @Builder.Default
    long recordMaxBytes = BatchPacker.DEFAULT_MAX_RECORD_BYTES;
    @Builder.Default
    int writerConcurrency = 4;

    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.defaults();

    public static IngestorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static IngestorConfig fromEnvironment(Map<String, String> env) {
        RetryPolicy retry = RetryPolicy.builder()
                .maxRetries(intValue(env, "MAX_RETRIES", "3"))
                .initialDelay(Duration.ofMillis(longValue(env, "RETRY_INITIAL_DELAY_MS", "500")))
                .maxDelay(Duration.ofMillis(longValue(env, "RETRY_MAX_DELAY_MS", "30000")))
                .multiplier(doubleValue(env, "RETRY_MULTIPLIER", "2.0"))
                .jitterFactor(doubleValue(env, "RETRY_JITTER", "0.5"))
                .build();

        IngestorConfig config = IngestorConfig.builder()
                .newsApiKey(getEnv(env, "NEWSAPI_KEY", ""))
                .newsApiBaseUrl(getEnv(env, "NEWSAPI_BASE_URL", NewsApiClient.DEFAULT_BASE_URL))
                .query(getEnv(env, "NEWSAPI_QUERY", "technology"))
                .pageSize(intValue(env, "NEWSAPI_PAGE_SIZE", "100"))
                .sortBy(getEnv(env, "NEWSAPI_SORT_BY", "publishedAt"))
                .language(getEnv(env, "NEWSAPI_LANGUAGE", "en"))
                .maxPages(intValue(env, "NEWSAPI_MAX_PAGES", "5"))
                .pageDelay(Duration.ofMillis(longValue(env, "NEWSAPI_PAGE_DELAY_MS", "1000")))
                .maxLookback(Duration.ofHours(longValue(env, "NEWSAPI_MAX_LOOKBACK_HOURS", "720")))
                .lookback(Duration.ofHours(longValue(env, "HOURS_BACK", "24")))
                .pollInterval(Duration.ofSeconds(longValue(env, "POLL_INTERVAL_SECONDS", "300")))
                .maxTicks(intValue(env, "MAX_TICKS", "0"))
                .backendType(StreamBackendType.parse(getEnv(env, "STREAM_BACKEND", "kinesis")))
                .streamName(getEnv(env, "KINESIS_STREAM_NAME", "news-ingest-stream"))
                .awsRegion(getEnv(env, "AWS_REGION", "us-east-1"))
                .awsEndpointUrl(env.get("AWS_ENDPOINT_URL"))
                .kafkaBootstrapServers(getEnv(env, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                .batchMaxRecords(intValue(env, "BATCH_MAX_RECORDS", "500"))
                .batchMaxBytes(longValue(env, "BATCH_MAX_BYTES", String.valueOf(BatchPacker.DEFAULT_MAX_BATCH_BYTES)))
                .recordMaxBytes(longValue(env, "RECORD_MAX_BYTES", String.valueOf(BatchPacker.DEFAULT_MAX_RECORD_BYTES)))
                .writerConcurrency(intValue(env, "WRITER_CONCURRENCY", "4"))
                .retryPolicy(retry)
                .build();
        config.validate();
        return config;
    }

    /**
     * @throws IllegalArgumentException naming the first invalid setting
     */
    public void validate() {
        require(newsApiKey != null && !newsApiKey.isBlank(), "NEWSAPI_KEY environment variable is required");
        require(streamName != null && !streamName.isBlank(), "KINESIS_STREAM_NAME environment variable is required");
        require(query != null && !query.isBlank(), "NEWSAPI_QUERY must not be empty");
        require(pageSize >= 1 && pageSize <= 100, "NEWSAPI_PAGE_SIZE must be between 1 and 100");
        require(maxPages >= 1, "NEWSAPI_MAX_PAGES must be at least 1");
        require(!lookback.isNegative() && !lookback.isZero(), "HOURS_BACK must be positive");
        require(!pollInterval.isNegative(), "POLL_INTERVAL_SECONDS must not be negative");
        require(maxTicks >= 0, "MAX_TICKS must not be negative");
        require(batchMaxRecords >= 1 && batchMaxRecords <= BatchPacker.DEFAULT_MAX_RECORDS,
                "BATCH_MAX_RECORDS must be between 1 and " + BatchPacker.DEFAULT_MAX_RECORDS);
        require(recordMaxBytes >= 1 && recordMaxBytes <= batchMaxBytes,
                "RECORD_MAX_BYTES must be positive and not exceed BATCH_MAX_BYTES");
        require(writerConcurrency >= 1 && writerConcurrency <= 8, "WRITER_CONCURRENCY must be between 1 and 8");
        require(retryPolicy.getMaxRetries() >= 0, "MAX_RETRIES must not be negative");
        require(retryPolicy.getInitialDelay().toMillis() >= 1, "RETRY_INITIAL_DELAY_MS must be at least 1");
        require(retryPolicy.getMaxDelay().compareTo(retryPolicy.getInitialDelay()) >= 0,
                "RETRY_MAX_DELAY_MS must not be less than RETRY_INITIAL_DELAY_MS");
        require(retryPolicy.getMultiplier() >= 1.0, "RETRY_MULTIPLIER must be at least 1.0");
        require(retryPolicy.getJitterFactor() >= 0 && retryPolicy.getJitterFactor() < 1,
                "RETRY_JITTER must be in [0, 1)");
    }

    public SearchQuery searchQuery() {
        return SearchQuery.builder()
                .query(query)
                .pageSize(pageSize)
                .sortBy(sortBy)
                .language(language)
                .build();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    private static String getEnv(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return value != null ? value : defaultValue;
    }

    private static int intValue(Map<String, String> env, String name, String defaultValue) {
        String value = getEnv(env, name, defaultValue);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static long longValue(Map<String, String> env, String name, String defaultValue) {
        String value = getEnv(env, name, defaultValue);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static double doubleValue(Map<String, String> env, String name, String defaultValue) {
        String value = getEnv(env, name, defaultValue);
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number, got '" + value + "'", e);
        }
    }
}
