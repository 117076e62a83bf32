package com.carbondna.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Immutable daily checkpoint: the Merkle root over the record hashes a
 * partition produced during one UTC calendar day.
 */
@Entity
@Table(name = "merkle_anchors",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_anchor_partition_period", columnNames = {"partition_id", "period_date"})
    })
public class MerkleAnchor {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "partition_id", nullable = false, length = LedgerRecord.MAX_PARTITION_LENGTH)
    private String partitionId;

    @NotNull
    @Column(name = "period_date", nullable = false)
    private LocalDate periodDate;

    @NotNull
    @Column(name = "root_hash", nullable = false, length = 64)
    private String rootHash;

    @Column(name = "record_count", nullable = false)
    private int recordCount;

    @Column(name = "first_seq_no", nullable = false)
    private long firstSequence;

    @Column(name = "last_seq_no", nullable = false)
    private long lastSequence;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected MerkleAnchor() {}

    public static MerkleAnchor create(
            String partitionId,
            LocalDate periodDate,
            String rootHash,
            int recordCount,
            long firstSequence,
            long lastSequence,
            Instant createdAt) {

        LedgerRecord.requirePartition(partitionId);
        if (periodDate == null) {
            throw new IllegalArgumentException("Period date is required");
        }
        if (!LedgerRecord.isHash(rootHash)) {
            throw new IllegalArgumentException("Root hash must be 64 lowercase hex characters");
        }
        if (recordCount < 1) {
            throw new IllegalArgumentException("An anchor must cover at least one record");
        }
        if (firstSequence < 1 || lastSequence < firstSequence) {
            throw new IllegalArgumentException("Invalid sequence range " + firstSequence + ".." + lastSequence);
        }

        var anchor = new MerkleAnchor();
        anchor.partitionId = partitionId;
        anchor.periodDate = periodDate;
        anchor.rootHash = rootHash;
        anchor.recordCount = recordCount;
        anchor.firstSequence = firstSequence;
        anchor.lastSequence = lastSequence;
        anchor.createdAt = createdAt != null ? createdAt : Instant.now();
        return anchor;
    }

    public boolean matches(String otherRoot, int otherCount) {
        return rootHash.equals(otherRoot) && recordCount == otherCount;
    }

    public UUID getId() { return id; }
    public String getPartitionId() { return partitionId; }
    public LocalDate getPeriodDate() { return periodDate; }
    public String getRootHash() { return rootHash; }
    public int getRecordCount() { return recordCount; }
    public long getFirstSequence() { return firstSequence; }
    public long getLastSequence() { return lastSequence; }
    public Instant getCreatedAt() { return createdAt; }
}
