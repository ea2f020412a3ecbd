package com.newspulse.ingestor.stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamSummaryRequest;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamSummaryResponse;
import software.amazon.awssdk.services.kinesis.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResultEntry;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;
import software.amazon.awssdk.services.kinesis.model.StreamDescriptionSummary;
import software.amazon.awssdk.services.kinesis.model.StreamStatus;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KinesisStreamBackendTest {

    @Mock
    KinesisClient client;

    private static StreamRecord record(String key) {
        return new StreamRecord(key, ("{\"article_id\":\"" + key + "\"}").getBytes(StandardCharsets.UTF_8));
    }

    private static DescribeStreamSummaryResponse status(StreamStatus status) {
        return DescribeStreamSummaryResponse.builder()
                .streamDescriptionSummary(StreamDescriptionSummary.builder().streamStatus(status).build())
                .build();
    }

    @Test
    void partialFailureIsMappedPerRecordInOrder() throws Exception {
        when(client.putRecords(any(PutRecordsRequest.class))).thenReturn(PutRecordsResponse.builder()
                .failedRecordCount(2)
                .records(
                        PutRecordsResultEntry.builder().shardId("shardId-000").sequenceNumber("1").build(),
                        PutRecordsResultEntry.builder()
                                .errorCode("ProvisionedThroughputExceededException")
                                .errorMessage("Rate exceeded")
                                .build(),
                        PutRecordsResultEntry.builder()
                                .errorCode("KMSAccessDeniedException")
                                .errorMessage("denied")
                                .build())
                .build());

        List<PutRecordResult> results = new KinesisStreamBackend(client)
                .putRecords("news", List.of(record("a"), record("b"), record("c")));

        assertThat(results).hasSize(3);
        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(0).getRecordId()).isEqualTo("shardId-000/1");
        assertThat(results.get(1).isRetryable()).isTrue();
        assertThat(results.get(1).getErrorCode()).isEqualTo("ProvisionedThroughputExceededException");
        assertThat(results.get(2).isSuccess()).isFalse();
        assertThat(results.get(2).isRetryable()).isFalse();
    }

    @Test
    void requestUsesArticleIdAsPartitionKey() throws Exception {
        when(client.putRecords(any(PutRecordsRequest.class))).thenReturn(PutRecordsResponse.builder()
                .failedRecordCount(0)
                .records(PutRecordsResultEntry.builder().shardId("s").sequenceNumber("1").build())
                .build());

        new KinesisStreamBackend(client).putRecords("news", List.of(record("abc123")));

        ArgumentCaptor<PutRecordsRequest> captor = ArgumentCaptor.forClass(PutRecordsRequest.class);
        verify(client).putRecords(captor.capture());
        PutRecordsRequest request = captor.getValue();
        assertThat(request.streamName()).isEqualTo("news");
        assertThat(request.records()).singleElement().satisfies(entry -> {
            assertThat(entry.partitionKey()).isEqualTo("abc123");
            assertThat(entry.data().asUtf8String()).isEqualTo("{\"article_id\":\"abc123\"}");
        });
    }

    @Test
    void throttledCallIsRetryable() {
        when(client.putRecords(any(PutRecordsRequest.class))).thenThrow(ProvisionedThroughputExceededException.builder()
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("ProvisionedThroughputExceededException").build())
                .message("Rate exceeded")
                .build());

        assertThatThrownBy(() -> new KinesisStreamBackend(client).putRecords("news", List.of(record("a"))))
                .isInstanceOfSatisfying(BackendException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getErrorCode()).isEqualTo("ProvisionedThroughputExceededException");
                });
    }

    @Test
    void missingStreamOnPutIsFatal() {
        when(client.putRecords(any(PutRecordsRequest.class))).thenThrow(ResourceNotFoundException.builder()
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("ResourceNotFoundException").build())
                .message("Stream news not found")
                .build());

        assertThatThrownBy(() -> new KinesisStreamBackend(client).putRecords("news", List.of(record("a"))))
                .isInstanceOfSatisfying(BackendException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    void networkFailureIsRetryable() {
        when(client.putRecords(any(PutRecordsRequest.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        assertThatThrownBy(() -> new KinesisStreamBackend(client).putRecords("news", List.of(record("a"))))
                .isInstanceOfSatisfying(BackendException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    void activeStreamPassesConnectivityCheck() throws Exception {
        when(client.describeStreamSummary(any(DescribeStreamSummaryRequest.class)))
                .thenReturn(status(StreamStatus.ACTIVE));

        new KinesisStreamBackend(client).checkConnectivity("news");
    }

    @Test
    void creatingStreamFailsConnectivityCheck() {
        when(client.describeStreamSummary(any(DescribeStreamSummaryRequest.class)))
                .thenReturn(status(StreamStatus.CREATING));

        assertThatThrownBy(() -> new KinesisStreamBackend(client).checkConnectivity("news"))
                .isInstanceOf(BackendConnectivityException.class)
                .hasMessageContaining("CREATING");
    }

    @Test
    void missingStreamFailsConnectivityCheck() {
        when(client.describeStreamSummary(any(DescribeStreamSummaryRequest.class)))
                .thenThrow(ResourceNotFoundException.builder().message("not found").build());

        assertThatThrownBy(() -> new KinesisStreamBackend(client).checkConnectivity("news"))
                .isInstanceOf(BackendConnectivityException.class)
                .hasMessageContaining("not found");
    }
}
