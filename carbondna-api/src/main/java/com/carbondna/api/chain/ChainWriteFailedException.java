package com.carbondna.api.chain;

/**
 * An append could not be completed: head conflicts persisted past the retry
 * budget, or the partition lock could not be acquired in time. Nothing was
 * written; the record was not accepted.
 */
public class ChainWriteFailedException extends RuntimeException {

    private final String partitionId;

    public ChainWriteFailedException(String partitionId, String message, Throwable cause) {
        super(message, cause);
        this.partitionId = partitionId;
    }

    public String getPartitionId() {
        return partitionId;
    }
}
