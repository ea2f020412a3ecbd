package com.newspulse.ingestor.writer;

/**
 * Where in the write path a record was dropped
 */
public enum DropStage {
    SERIALIZATION,
    PACKING,
    BACKEND
}
