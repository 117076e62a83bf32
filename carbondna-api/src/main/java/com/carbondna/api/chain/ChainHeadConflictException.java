package com.carbondna.api.chain;

/**
 * Another writer advanced the partition head between our read and our write.
 * The attempt was rolled back; retrying against the refreshed head is safe.
 */
public class ChainHeadConflictException extends RuntimeException {

    private final String partitionId;

    public ChainHeadConflictException(String partitionId, String expectedHead, Throwable cause) {
        super("Chain head of partition '" + partitionId + "' moved past " + expectedHead, cause);
        this.partitionId = partitionId;
    }

    public String getPartitionId() {
        return partitionId;
    }
}
