package com.newspulse.ingestor.stream;

import java.util.List;

/**
 * Partitioned, at-least-once log that accepts batched puts.
 * <p>
 * Implementations must be safe for concurrent use: the batch writer calls
 * {@link #putRecords} from several worker threads at once through a single
 * instance.
 */
public interface StreamBackend extends AutoCloseable {

    /**
     * Verify that the stream exists and accepts writes.
     *
     * @throws BackendConnectivityException when it does not
     */
    void checkConnectivity(String streamName) throws BackendConnectivityException;

    /**
     * Write a batch. Individual records may fail while others succeed; the
     * returned list holds one result per input record, in input order.
     *
     * @throws BackendException when the call fails as a whole
     */
    List<PutRecordResult> putRecords(String streamName, List<StreamRecord> records) throws BackendException;

    @Override
    void close();
}
