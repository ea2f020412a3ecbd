package com.newspulse.ingestor.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.KinesisClientBuilder;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamSummaryRequest;
import software.amazon.awssdk.services.kinesis.model.KinesisException;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequestEntry;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResultEntry;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;
import software.amazon.awssdk.services.kinesis.model.StreamStatus;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Kinesis Data Streams backend over the AWS SDK v2 synchronous client.
 * The SDK client is thread-safe, so one instance serves every writer thread.
 */
public class KinesisStreamBackend implements StreamBackend {

    private static final Logger logger = LoggerFactory.getLogger(KinesisStreamBackend.class);

    /**
     * Per-record and whole-call error codes worth retrying
     */
    static final Set<String> RETRYABLE_CODES = Set.of(
            "ProvisionedThroughputExceededException",
            "InternalFailure",
            "ServiceUnavailable",
            "KMSThrottlingException",
            "LimitExceededException",
            "ThrottlingException");

    private final KinesisClient client;

    public KinesisStreamBackend(KinesisClient client) {
        this.client = client;
    }

    /**
     * Build a client for the region, optionally against a custom endpoint
     * such as LocalStack
     */
    public static KinesisStreamBackend create(String region, String endpointOverride) {
        KinesisClientBuilder builder = KinesisClient.builder().region(Region.of(region));
        if (endpointOverride != null && !endpointOverride.isBlank()) {
            builder.endpointOverride(URI.create(endpointOverride));
        }
        logger.info("Kinesis client created for region {}{}", region,
                endpointOverride != null ? " (endpoint " + endpointOverride + ")" : "");
        return new KinesisStreamBackend(builder.build());
    }

    @Override
    public void checkConnectivity(String streamName) throws BackendConnectivityException {
        try {
            StreamStatus status = client.describeStreamSummary(DescribeStreamSummaryRequest.builder()
                            .streamName(streamName)
                            .build())
                    .streamDescriptionSummary()
                    .streamStatus();
            logger.info("Kinesis stream '{}' status: {}", streamName, status);
            if (status != StreamStatus.ACTIVE && status != StreamStatus.UPDATING) {
                throw new BackendConnectivityException(
                        "Kinesis stream '" + streamName + "' is not writable (status " + status + ")");
            }
        } catch (ResourceNotFoundException e) {
            throw new BackendConnectivityException("Kinesis stream '" + streamName + "' not found", e);
        } catch (SdkException e) {
            throw new BackendConnectivityException("Error connecting to Kinesis: " + e.getMessage(), e);
        }
    }

    @Override
    public List<PutRecordResult> putRecords(String streamName, List<StreamRecord> records) throws BackendException {
        List<PutRecordsRequestEntry> entries = new ArrayList<>(records.size());
        for (StreamRecord record : records) {
            entries.add(PutRecordsRequestEntry.builder()
                    .partitionKey(record.getPartitionKey())
                    .data(SdkBytes.fromByteArray(record.getData()))
                    .build());
        }

        PutRecordsResponse response;
        try {
            response = client.putRecords(PutRecordsRequest.builder()
                    .streamName(streamName)
                    .records(entries)
                    .build());
        } catch (KinesisException e) {
            String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : "Unknown";
            logger.error("AWS Kinesis batch error ({}): {}", code, e.getMessage());
            throw new BackendException(code, e.getMessage(), RETRYABLE_CODES.contains(code) || e.isThrottlingException(), e);
        } catch (SdkClientException e) {
            logger.error("Error sending batch to Kinesis: {}", e.getMessage());
            throw new BackendException("ClientError", e.getMessage(), true, e);
        }

        List<PutRecordResult> results = new ArrayList<>(response.records().size());
        for (PutRecordsResultEntry entry : response.records()) {
            if (entry.errorCode() == null) {
                results.add(PutRecordResult.ok(entry.shardId() + "/" + entry.sequenceNumber()));
            } else if (RETRYABLE_CODES.contains(entry.errorCode())) {
                results.add(PutRecordResult.retryableFailure(entry.errorCode(), entry.errorMessage()));
            } else {
                results.add(PutRecordResult.permanentFailure(entry.errorCode(), entry.errorMessage()));
            }
        }

        Integer failed = response.failedRecordCount();
        if (failed != null && failed > 0) {
            logger.warn("Failed to send {} records to Kinesis. Successfully sent {} records.",
                    failed, records.size() - failed);
        } else {
            logger.debug("Successfully sent {} records to Kinesis", records.size());
        }
        return results;
    }

    @Override
    public void close() {
        client.close();
        logger.info("Kinesis client closed");
    }
}
