package com.carbondna.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Mutable quality metadata attached to a ledger record (uncertainty,
 * data-quality score, flags). Kept outside the hashed payload so that
 * re-scoring never touches the chain.
 */
@Entity
@Table(name = "record_annotations", indexes = {
    @Index(name = "idx_annotation_partition", columnList = "partition_id")
})
public class RecordAnnotation {

    public static final int MAX_ATTRIBUTES_LENGTH = 8192;

    @Id
    @Column(name = "record_id")
    private UUID recordId;

    @NotNull
    @Column(name = "partition_id", nullable = false, length = LedgerRecord.MAX_PARTITION_LENGTH)
    private String partitionId;

    // JSON object, keys sorted
    @NotNull
    @Column(nullable = false, length = MAX_ATTRIBUTES_LENGTH)
    private String attributes;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected RecordAnnotation() {}

    public static RecordAnnotation create(UUID recordId, String partitionId, String attributes, Instant now) {
        if (recordId == null) {
            throw new IllegalArgumentException("Record id is required");
        }
        LedgerRecord.requirePartition(partitionId);
        var annotation = new RecordAnnotation();
        annotation.recordId = recordId;
        annotation.partitionId = partitionId;
        annotation.replace(attributes, now);
        return annotation;
    }

    public void replace(String attributes, Instant now) {
        this.attributes = requireAttributes(attributes);
        this.updatedAt = now != null ? now : Instant.now();
    }

    public static String requireAttributes(String attributes) {
        if (attributes == null || attributes.isBlank()) {
            throw new IllegalArgumentException("Attributes must not be blank");
        }
        if (attributes.length() > MAX_ATTRIBUTES_LENGTH) {
            throw new IllegalArgumentException("Attributes take " + attributes.length()
                    + " characters, the limit is " + MAX_ATTRIBUTES_LENGTH);
        }
        return attributes;
    }

    public UUID getRecordId() { return recordId; }
    public String getPartitionId() { return partitionId; }
    public String getAttributes() { return attributes; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getVersion() { return version; }
}
