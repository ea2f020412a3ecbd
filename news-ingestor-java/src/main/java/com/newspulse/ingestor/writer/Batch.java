package com.newspulse.ingestor.writer;

import com.newspulse.ingestor.stream.StreamRecord;
import lombok.Value;

import java.util.List;

/**
 * Records submitted together in one batched put
 */
@Value
public class Batch {

    List<StreamRecord> records;
    long sizeInBytes;

    public int size() {
        return records.size();
    }
}
