package com.carbondna.api.chain;

import com.carbondna.api.canonical.CanonicalizationException;
import com.carbondna.api.canonical.FieldMap;
import com.carbondna.api.canonical.FieldValue;
import com.carbondna.api.config.LedgerProperties;
import com.carbondna.core.domain.LedgerRecord;
import com.carbondna.core.repository.LedgerRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Appends emission records to their partition's hash chain.
 *
 * <p>Writes to one partition are serialized through {@link PartitionLocks};
 * the lock is held until the append transaction has committed. If another
 * process moved the head anyway, the attempt is retried against the new head
 * up to {@code carbondna.ledger.max-append-attempts} times.
 *
 * <p>Annotation fields (uncertainty, data-quality score and the like) are
 * split off before hashing and stored beside the record.
 */
@Service
public class ChainBuilder {

    private static final Logger log = LoggerFactory.getLogger(ChainBuilder.class);

    /** Hashed back-reference carried by every amendment. */
    public static final String SUPERSEDES_FIELD = "supersedes";

    private final ChainLinker chainLinker;
    private final PartitionLocks partitionLocks;
    private final PartitionResolver partitionResolver;
    private final LedgerRecordRepository recordRepository;
    private final LedgerProperties properties;

    public ChainBuilder(
            ChainLinker chainLinker,
            PartitionLocks partitionLocks,
            PartitionResolver partitionResolver,
            LedgerRecordRepository recordRepository,
            LedgerProperties properties) {
        this.chainLinker = chainLinker;
        this.partitionLocks = partitionLocks;
        this.partitionResolver = partitionResolver;
        this.recordRepository = recordRepository;
        this.properties = properties;
    }

    /**
     * Appends to the partition derived from the payload itself.
     */
    public LedgerRecord append(FieldMap payload) {
        requirePayload(payload);
        return append(partitionResolver.resolve(payload), payload);
    }

    public LedgerRecord append(String partitionId, FieldMap payload) {
        requirePayload(payload);
        rejectReserved(payload);
        String partition = partitionResolver.normalize(partitionId);
        FieldMap.Split split = payload.split(properties.annotationFieldSet());
        return write(partition, requireHashed(split.remaining()), split.selected(), null);
    }

    /**
     * Records a correction as a new record that supersedes {@code recordId}.
     * The original stays untouched; the new record lands in the same partition
     * and carries the superseded id in its hashed payload.
     */
    public LedgerRecord amend(UUID recordId, FieldMap newPayload) {
        requirePayload(newPayload);
        rejectReserved(newPayload);
        LedgerRecord original = getRecord(recordId);

        FieldMap.Split split = newPayload.split(properties.annotationFieldSet());
        FieldMap hashed = requireHashed(split.remaining())
                .with(SUPERSEDES_FIELD, FieldValue.text(recordId.toString()));

        LedgerRecord amended = write(original.getPartitionId(), hashed, split.selected(), recordId);
        log.info("Record {} superseded by {} in partition {}", recordId, amended.getId(), amended.getPartitionId());
        return amended;
    }

    public LedgerRecord getRecord(UUID recordId) {
        return recordRepository.findById(recordId)
                .orElseThrow(() -> new RecordNotFoundException(recordId));
    }

    /**
     * Follows the supersession links from a record to its latest revision.
     */
    public LedgerRecord currentRevision(UUID recordId) {
        LedgerRecord current = getRecord(recordId);
        Set<UUID> seen = new HashSet<>();
        seen.add(current.getId());
        Optional<LedgerRecord> next;
        while ((next = recordRepository.findBySupersedesId(current.getId())).isPresent()) {
            current = next.get();
            if (!seen.add(current.getId())) {
                throw new IllegalStateException("Supersession cycle at record " + current.getId());
            }
        }
        return current;
    }

    public Page<LedgerRecord> listRecords(String partitionId, Pageable pageable) {
        return recordRepository.findByPartitionIdOrderBySequenceAsc(
                partitionResolver.normalize(partitionId), pageable);
    }

    private LedgerRecord write(String partitionId, FieldMap hashed, FieldMap annotation, UUID supersedesId) {
        int maxAttempts = Math.max(1, properties.getMaxAppendAttempts());
        return partitionLocks.withLock(partitionId, () -> {
            ChainHeadConflictException lastConflict = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                try {
                    return chainLinker.link(partitionId, hashed, annotation, supersedesId);
                } catch (ChainHeadConflictException e) {
                    lastConflict = e;
                    log.warn("Chain head conflict on partition {} (attempt {}/{})", partitionId, attempt, maxAttempts);
                }
            }
            log.error("Giving up append to partition {} after {} attempts", partitionId, maxAttempts);
            throw new ChainWriteFailedException(partitionId,
                    "Append to partition '" + partitionId + "' failed after " + maxAttempts + " attempts",
                    lastConflict);
        });
    }

    private static void requirePayload(FieldMap payload) {
        if (payload == null || payload.isEmpty()) {
            throw new CanonicalizationException("Payload must contain at least one field");
        }
    }

    private static FieldMap requireHashed(FieldMap hashed) {
        if (hashed.isEmpty()) {
            throw new CanonicalizationException("Payload has no fields left to hash after removing annotation fields");
        }
        return hashed;
    }

    private static void rejectReserved(FieldMap payload) {
        for (String key : payload.keys()) {
            if (key.equals(SUPERSEDES_FIELD) || key.startsWith(SUPERSEDES_FIELD + ".")) {
                throw new CanonicalizationException("Field '" + SUPERSEDES_FIELD + "' is reserved for amendments");
            }
        }
    }
}
