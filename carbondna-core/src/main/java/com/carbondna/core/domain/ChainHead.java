package com.carbondna.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted head of a ledger partition's hash chain.
 * Every append reads the head, links the new record to it and advances it in
 * the same transaction. The version column turns a concurrent advance by
 * another writer into an optimistic locking failure instead of a fork.
 */
@Entity
@Table(name = "chain_heads")
public class ChainHead {

    @Id
    @Column(name = "partition_id", length = LedgerRecord.MAX_PARTITION_LENGTH)
    private String partitionId;

    @NotNull
    @Column(name = "head_hash", nullable = false, length = 64)
    private String headHash;

    @Column(name = "head_record_id")
    private UUID headRecordId;

    @Column(name = "seq_no", nullable = false)
    private long sequence;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected ChainHead() {}

    /**
     * Head of a partition that has no records yet.
     */
    public static ChainHead genesis(String partitionId, Instant now) {
        LedgerRecord.requirePartition(partitionId);
        var head = new ChainHead();
        head.partitionId = partitionId;
        head.headHash = LedgerRecord.GENESIS_HASH;
        head.sequence = 0;
        head.updatedAt = now != null ? now : Instant.now();
        return head;
    }

    public long nextSequence() {
        return sequence + 1;
    }

    /**
     * Moves the head to a record that was linked to the current head.
     */
    public void advance(LedgerRecord record) {
        if (!partitionId.equals(record.getPartitionId())) {
            throw new IllegalArgumentException("Record belongs to partition " + record.getPartitionId()
                    + ", not " + partitionId);
        }
        if (!headHash.equals(record.getPreviousHash())) {
            throw new IllegalStateException("Record does not link to the current head of " + partitionId);
        }
        if (record.getSequence() != nextSequence()) {
            throw new IllegalStateException("Expected sequence " + nextSequence()
                    + " but record has " + record.getSequence());
        }
        this.headHash = record.getRecordHash();
        this.headRecordId = record.getId();
        this.sequence = record.getSequence();
        this.updatedAt = record.getCreatedAt();
    }

    public boolean isEmpty() {
        return sequence == 0;
    }

    public String getPartitionId() { return partitionId; }
    public String getHeadHash() { return headHash; }
    public UUID getHeadRecordId() { return headRecordId; }
    public long getSequence() { return sequence; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getVersion() { return version; }
}
