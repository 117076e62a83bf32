package com.carbondna.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Immutable carbon-emission ledger record.
 * Each record carries its canonical payload, a random salt, the hash of the
 * record that headed the partition chain when it was written, and its own hash.
 * There are no setters: corrections are new records that supersede this one.
 */
@Entity
@Table(name = "ledger_records",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_record_partition_seq", columnNames = {"partition_id", "seq_no"}),
        @UniqueConstraint(name = "uq_record_partition_prev", columnNames = {"partition_id", "previous_hash"}),
        @UniqueConstraint(name = "uq_record_hash", columnNames = {"record_hash"}),
        @UniqueConstraint(name = "uq_record_supersedes", columnNames = {"supersedes_id"})
    },
    indexes = {
        @Index(name = "idx_record_partition_created", columnList = "partition_id, created_at")
    })
public class LedgerRecord {

    /** Predecessor hash of the first record in every partition. */
    public static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    public static final int MAX_PARTITION_LENGTH = 128;
    public static final int MAX_PAYLOAD_LENGTH = 65535;

    private static final Pattern HASH_PATTERN = Pattern.compile("[0-9a-f]{64}");
    private static final Pattern SALT_PATTERN = Pattern.compile("[0-9a-f]{32}");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "partition_id", nullable = false, length = MAX_PARTITION_LENGTH)
    private String partitionId;

    @Column(name = "seq_no", nullable = false)
    private long sequence;

    @NotNull
    @Column(nullable = false, length = MAX_PAYLOAD_LENGTH)
    private String payload;

    @NotNull
    @Column(nullable = false, length = 32)
    private String salt;

    @NotNull
    @Column(name = "previous_hash", nullable = false, length = 64)
    private String previousHash;

    @NotNull
    @Column(name = "record_hash", nullable = false, length = 64)
    private String recordHash;

    @NotNull
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "supersedes_id")
    private UUID supersedesId;

    protected LedgerRecord() {}

    /**
     * Creates a chained record. The hash must already have been computed over
     * the given payload, salt and previous hash.
     */
    public static LedgerRecord create(
            String partitionId,
            long sequence,
            String payload,
            String salt,
            String previousHash,
            String recordHash,
            Instant createdAt,
            UUID supersedesId) {

        requirePartition(partitionId);
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence must be positive, got " + sequence);
        }
        if (payload == null || payload.length() > MAX_PAYLOAD_LENGTH) {
            throw new IllegalArgumentException("Payload must be present and at most "
                    + MAX_PAYLOAD_LENGTH + " characters");
        }
        if (salt == null || !SALT_PATTERN.matcher(salt).matches()) {
            throw new IllegalArgumentException("Salt must be 32 lowercase hex characters");
        }
        if (!isHash(previousHash)) {
            throw new IllegalArgumentException("Previous hash must be 64 lowercase hex characters");
        }
        if (!isHash(recordHash)) {
            throw new IllegalArgumentException("Record hash must be 64 lowercase hex characters");
        }
        if (sequence == 1 && !GENESIS_HASH.equals(previousHash)) {
            throw new IllegalArgumentException("First record of a partition must link to the genesis hash");
        }
        if (sequence > 1 && GENESIS_HASH.equals(previousHash)) {
            throw new IllegalArgumentException("Only the first record of a partition may link to the genesis hash");
        }

        var record = new LedgerRecord();
        record.partitionId = partitionId;
        record.sequence = sequence;
        record.payload = payload;
        record.salt = salt;
        record.previousHash = previousHash;
        record.recordHash = recordHash;
        record.createdAt = createdAt != null ? createdAt : Instant.now();
        record.supersedesId = supersedesId;
        return record;
    }

    public static boolean isHash(String value) {
        return value != null && HASH_PATTERN.matcher(value).matches();
    }

    static void requirePartition(String partitionId) {
        if (partitionId == null || partitionId.isBlank()) {
            throw new IllegalArgumentException("Partition id must not be blank");
        }
        if (partitionId.length() > MAX_PARTITION_LENGTH) {
            throw new IllegalArgumentException("Partition id must be at most "
                    + MAX_PARTITION_LENGTH + " characters");
        }
    }

    public boolean isGenesis() {
        return sequence == 1;
    }

    public boolean isAmendment() {
        return supersedesId != null;
    }

    // Getters (immutable - no setters)
    public UUID getId() { return id; }
    public String getPartitionId() { return partitionId; }
    public long getSequence() { return sequence; }
    public String getPayload() { return payload; }
    public String getSalt() { return salt; }
    public String getPreviousHash() { return previousHash; }
    public String getRecordHash() { return recordHash; }
    public Instant getCreatedAt() { return createdAt; }
    public UUID getSupersedesId() { return supersedesId; }
}
