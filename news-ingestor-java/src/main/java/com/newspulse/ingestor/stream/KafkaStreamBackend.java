package com.newspulse.ingestor.stream;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Kafka backend: the stream name is the topic and the partition key is the
 * record key, so repeat ingestions of an article land on the same partition.
 * {@link KafkaProducer} is thread-safe and shared by all writer threads.
 */
public class KafkaStreamBackend implements StreamBackend {

    private static final Logger logger = LoggerFactory.getLogger(KafkaStreamBackend.class);

    private final Producer<String, byte[]> producer;

    public KafkaStreamBackend(Producer<String, byte[]> producer) {
        this.producer = producer;
    }

    public static KafkaStreamBackend create(String bootstrapServers) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        // the batch writer owns retries
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "false");
        props.put(ProducerConfig.RETRIES_CONFIG, "0");
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, "10000");

        logger.info("Kafka producer bootstrap.servers={}", bootstrapServers);
        return new KafkaStreamBackend(new KafkaProducer<>(props));
    }

    @Override
    public void checkConnectivity(String streamName) throws BackendConnectivityException {
        try {
            List<PartitionInfo> partitions = producer.partitionsFor(streamName);
            if (partitions == null || partitions.isEmpty()) {
                throw new BackendConnectivityException("Kafka topic '" + streamName + "' not found");
            }
            logger.info("Kafka topic '{}' has {} partitions", streamName, partitions.size());
        } catch (KafkaException e) {
            throw new BackendConnectivityException("Error connecting to Kafka: " + e.getMessage(), e);
        }
    }

    @Override
    public List<PutRecordResult> putRecords(String streamName, List<StreamRecord> records) throws BackendException {
        List<Future<RecordMetadata>> futures = new ArrayList<>(records.size());
        try {
            for (StreamRecord record : records) {
                futures.add(producer.send(new ProducerRecord<>(streamName, record.getPartitionKey(), record.getData())));
            }
            producer.flush();
        } catch (KafkaException e) {
            throw new BackendException(e.getClass().getSimpleName(), e.getMessage(), e instanceof RetriableException, e);
        }

        List<PutRecordResult> results = new ArrayList<>(futures.size());
        for (Future<RecordMetadata> future : futures) {
            results.add(outcome(future));
        }
        return results;
    }

    private static PutRecordResult outcome(Future<RecordMetadata> future) throws BackendException {
        try {
            RecordMetadata metadata = future.get();
            return PutRecordResult.ok(metadata.partition() + "/" + metadata.offset());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String code = cause.getClass().getSimpleName();
            return cause instanceof RetriableException
                    ? PutRecordResult.retryableFailure(code, cause.getMessage())
                    : PutRecordResult.permanentFailure(code, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted", "Interrupted waiting for Kafka acknowledgements", true, e);
        }
    }

    @Override
    public void close() {
        producer.close(Duration.ofSeconds(10));
        logger.info("Kafka producer closed");
    }
}
