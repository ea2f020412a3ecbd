package com.newspulse.ingestor.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestorConfigTest {

    private static Map<String, String> env(String... pairs) {
        Map<String, String> env = new HashMap<>();
        env.put("NEWSAPI_KEY", "secret");
        for (int i = 0; i < pairs.length; i += 2) {
            env.put(pairs[i], pairs[i + 1]);
        }
        return env;
    }

    @Test
    void defaultsApplyWhenOnlyTheKeyIsSet() {
        IngestorConfig config = IngestorConfig.fromEnvironment(env());

        assertThat(config.getQuery()).isEqualTo("technology");
        assertThat(config.getLookback()).isEqualTo(Duration.ofHours(24));
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getMaxLookback()).isEqualTo(Duration.ofDays(30));
        assertThat(config.getBackendType()).isEqualTo(StreamBackendType.KINESIS);
        assertThat(config.getStreamName()).isEqualTo("news-ingest-stream");
        assertThat(config.getAwsEndpointUrl()).isNull();
        assertThat(config.getBatchMaxRecords()).isEqualTo(500);
        assertThat(config.getWriterConcurrency()).isEqualTo(4);
        assertThat(config.getRetryPolicy().getMaxRetries()).isEqualTo(3);
        assertThat(config.getMaxTicks()).isZero();
    }

    @Test
    void readsOverrides() {
        IngestorConfig config = IngestorConfig.fromEnvironment(env(
                "NEWSAPI_QUERY", "climate",
                "HOURS_BACK", "6",
                "POLL_INTERVAL_SECONDS", "60",
                "STREAM_BACKEND", "Kafka",
                "KINESIS_STREAM_NAME", "articles",
                "MAX_RETRIES", "5",
                "RETRY_JITTER", "0",
                "WRITER_CONCURRENCY", "8"));

        assertThat(config.getQuery()).isEqualTo("climate");
        assertThat(config.getLookback()).isEqualTo(Duration.ofHours(6));
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getBackendType()).isEqualTo(StreamBackendType.KAFKA);
        assertThat(config.getStreamName()).isEqualTo("articles");
        assertThat(config.getRetryPolicy().getMaxRetries()).isEqualTo(5);
        assertThat(config.getRetryPolicy().getJitterFactor()).isZero();
        assertThat(config.getWriterConcurrency()).isEqualTo(8);
        assertThat(config.searchQuery().getQuery()).isEqualTo("climate");
    }

    @Test
    void missingApiKeyIsRejected() {
        Map<String, String> env = env();
        env.remove("NEWSAPI_KEY");

        assertThatThrownBy(() -> IngestorConfig.fromEnvironment(env))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("NEWSAPI_KEY environment variable is required");
    }

    @Test
    void nonNumericValueNamesTheVariable() {
        assertThatThrownBy(() -> IngestorConfig.fromEnvironment(env("HOURS_BACK", "a day")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("HOURS_BACK");
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertThatThrownBy(() -> IngestorConfig.fromEnvironment(env("WRITER_CONCURRENCY", "9")))
                .hasMessage("WRITER_CONCURRENCY must be between 1 and 8");
        assertThatThrownBy(() -> IngestorConfig.fromEnvironment(env("BATCH_MAX_RECORDS", "501")))
                .hasMessageContaining("BATCH_MAX_RECORDS");
        assertThatThrownBy(() -> IngestorConfig.fromEnvironment(env("HOURS_BACK", "0")))
                .hasMessage("HOURS_BACK must be positive");
        assertThatThrownBy(() -> IngestorConfig.fromEnvironment(env("RETRY_JITTER", "1.5")))
                .hasMessageContaining("RETRY_JITTER");
    }

    @Test
    void unknownBackendIsRejected() {
        assertThatThrownBy(() -> IngestorConfig.fromEnvironment(env("STREAM_BACKEND", "pubsub")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("STREAM_BACKEND");
    }

    @Test
    void retryDelaysAreCheckedAtStartup() {
        assertThatThrownBy(() -> IngestorConfig.fromEnvironment(env("RETRY_INITIAL_DELAY_MS", "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("RETRY_INITIAL_DELAY_MS must be at least 1");
        assertThatThrownBy(() -> IngestorConfig.fromEnvironment(env(
                "RETRY_INITIAL_DELAY_MS", "5000", "RETRY_MAX_DELAY_MS", "1000")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("RETRY_MAX_DELAY_MS");
    }
}
