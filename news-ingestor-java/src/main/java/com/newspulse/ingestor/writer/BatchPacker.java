package com.newspulse.ingestor.writer;

import com.newspulse.ingestor.stream.StreamRecord;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy, order preserving packing of records into batches bounded by record
 * count and total bytes. Records that exceed the per-record limit on their own
 * are returned separately instead of being packed.
 */
public class BatchPacker {

    /**
     * Kinesis PutRecords limits
     */
    public static final int DEFAULT_MAX_RECORDS = 500;
    public static final long DEFAULT_MAX_BATCH_BYTES = 5L * 1024 * 1024;
    public static final long DEFAULT_MAX_RECORD_BYTES = 1024L * 1024;

    private final int maxRecords;
    private final long maxBatchBytes;
    private final long maxRecordBytes;

    public BatchPacker(int maxRecords, long maxBatchBytes, long maxRecordBytes) {
        if (maxRecords < 1) {
            throw new IllegalArgumentException("maxRecords must be at least 1: " + maxRecords);
        }
        if (maxRecordBytes > maxBatchBytes) {
            throw new IllegalArgumentException("maxRecordBytes " + maxRecordBytes
                    + " exceeds maxBatchBytes " + maxBatchBytes);
        }
        this.maxRecords = maxRecords;
        this.maxBatchBytes = maxBatchBytes;
        this.maxRecordBytes = maxRecordBytes;
    }

    public BatchPacker() {
        this(DEFAULT_MAX_RECORDS, DEFAULT_MAX_BATCH_BYTES, DEFAULT_MAX_RECORD_BYTES);
    }

    public Packing pack(List<StreamRecord> records) {
        List<Batch> batches = new ArrayList<>();
        List<StreamRecord> oversized = new ArrayList<>();

        List<StreamRecord> current = new ArrayList<>();
        long currentBytes = 0;

        for (StreamRecord record : records) {
            long size = record.sizeInBytes();
            if (size > maxRecordBytes) {
                oversized.add(record);
                continue;
            }
            if (!current.isEmpty() && (current.size() >= maxRecords || currentBytes + size > maxBatchBytes)) {
                batches.add(new Batch(List.copyOf(current), currentBytes));
                current = new ArrayList<>();
                currentBytes = 0;
            }
            current.add(record);
            currentBytes += size;
        }
        if (!current.isEmpty()) {
            batches.add(new Batch(List.copyOf(current), currentBytes));
        }
        return new Packing(batches, oversized);
    }

    public long getMaxRecordBytes() {
        return maxRecordBytes;
    }

    @Value
    public static class Packing {
        List<Batch> batches;
        List<StreamRecord> oversized;
    }
}
