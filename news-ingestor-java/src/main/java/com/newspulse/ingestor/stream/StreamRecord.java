package com.newspulse.ingestor.stream;

import lombok.Value;

import java.nio.charset.StandardCharsets;

/**
 * One record handed to the stream backend. The partition key is the article id.
 */
@Value
public class StreamRecord {

    String partitionKey;
    byte[] data;

    /**
     * Size counted against backend limits: payload plus partition key bytes
     */
    public long sizeInBytes() {
        return (long) data.length + partitionKey.getBytes(StandardCharsets.UTF_8).length;
    }
}
