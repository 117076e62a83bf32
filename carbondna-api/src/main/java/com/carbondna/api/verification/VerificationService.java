package com.carbondna.api.verification;

import com.carbondna.api.anchor.AnchorNotFoundException;
import com.carbondna.api.anchor.AnchorPeriod;
import com.carbondna.api.anchor.MerkleTree;
import com.carbondna.api.canonical.CanonicalizationException;
import com.carbondna.api.canonical.Canonicalizer;
import com.carbondna.api.canonical.FieldMap;
import com.carbondna.api.chain.PartitionResolver;
import com.carbondna.api.chain.RecordNotFoundException;
import com.carbondna.api.config.LedgerProperties;
import com.carbondna.api.hashing.HashInputException;
import com.carbondna.api.hashing.RecordHasher;
import com.carbondna.core.domain.ChainHead;
import com.carbondna.core.domain.LedgerRecord;
import com.carbondna.core.domain.MerkleAnchor;
import com.carbondna.core.repository.ChainHeadRepository;
import com.carbondna.core.repository.LedgerRecordRepository;
import com.carbondna.core.repository.MerkleAnchorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only integrity checks over records, chains and anchors.
 *
 * <p>Nothing here writes. Tamper findings are returned as results and logged
 * at ERROR; exceptions are reserved for unknown ids and bad arguments.
 */
@Service
@Transactional(readOnly = true)
public class VerificationService {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private final LedgerRecordRepository recordRepository;
    private final ChainHeadRepository chainHeadRepository;
    private final MerkleAnchorRepository anchorRepository;
    private final Canonicalizer canonicalizer;
    private final RecordHasher hasher;
    private final PartitionResolver partitionResolver;
    private final LedgerProperties properties;
    private final Clock clock;

    public VerificationService(
            LedgerRecordRepository recordRepository,
            ChainHeadRepository chainHeadRepository,
            MerkleAnchorRepository anchorRepository,
            Canonicalizer canonicalizer,
            RecordHasher hasher,
            PartitionResolver partitionResolver,
            LedgerProperties properties,
            Clock clock) {
        this.recordRepository = recordRepository;
        this.chainHeadRepository = chainHeadRepository;
        this.anchorRepository = anchorRepository;
        this.canonicalizer = canonicalizer;
        this.hasher = hasher;
        this.partitionResolver = partitionResolver;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Rehashes a stored record with its stored salt and predecessor.
     */
    public RecordVerificationResult verifyRecord(UUID recordId) {
        LedgerRecord record = findRecord(recordId);
        RecordVerificationResult result = check(record);
        if (!result.ok()) {
            log.error("Tamper detected on record {} ({}#{}): {}", record.getId(),
                    record.getPartitionId(), record.getSequence(), result.detail());
        }
        return result;
    }

    private RecordVerificationResult check(LedgerRecord record) {
        String computed;
        try {
            FieldMap payload = canonicalizer.parse(record.getPayload());
            computed = hasher.hash(canonicalizer.canonicalize(payload), record.getSalt(), record.getPreviousHash());
        } catch (CanonicalizationException | HashInputException e) {
            return RecordVerificationResult.mismatch(record.getId(), record.getPartitionId(), record.getSequence(),
                    record.getRecordHash(), null, "Stored record cannot be rehashed: " + e.getMessage());
        }
        if (!computed.equals(record.getRecordHash())) {
            return RecordVerificationResult.mismatch(record.getId(), record.getPartitionId(), record.getSequence(),
                    record.getRecordHash(), computed, "Stored hash " + record.getRecordHash()
                            + " does not match recomputed " + computed);
        }
        return RecordVerificationResult.valid(record.getId(), record.getPartitionId(), record.getSequence(), computed);
    }

    /**
     * Walks a partition's chain in sequence order, optionally bounded by two
     * records of that partition, and stops at the first broken record.
     *
     * <p>Without an upper bound the walk ends at the chain head as it was
     * when the check started, and the head itself must match the last
     * record reached, so a truncated tail is reported too.
     */
    public ChainVerificationResult verifyChain(String partitionId, UUID fromId, UUID toId) {
        String partition = partitionResolver.normalize(partitionId);

        Optional<ChainHead> head = toId == null ? chainHeadRepository.findById(partition) : Optional.empty();
        long fromSeq = fromId != null ? boundSequence(partition, fromId) : 1L;
        long toSeq = toId != null
                ? boundSequence(partition, toId)
                : head.map(ChainHead::getSequence).orElse(Long.MAX_VALUE);
        if (toSeq < fromSeq) {
            throw new IllegalArgumentException("Range end precedes range start");
        }

        String expectedPrevious = fromSeq == 1
                ? LedgerRecord.GENESIS_HASH
                : recordRepository.findByPartitionIdAndSequence(partition, fromSeq - 1)
                        .map(LedgerRecord::getRecordHash)
                        .orElse(null);

        long expectedSeq = fromSeq;
        long checked = 0;
        int pageSize = Math.max(1, properties.getVerificationPageSize());
        Pageable page = PageRequest.of(0, pageSize);
        Slice<LedgerRecord> slice;
        do {
            slice = recordRepository.findByPartitionIdAndSequenceBetweenOrderBySequenceAsc(
                    partition, fromSeq, toSeq, page);
            for (LedgerRecord record : slice) {
                if (record.getSequence() != expectedSeq) {
                    return chainBreak(partition, checked, record,
                            "Expected sequence " + expectedSeq + " but found " + record.getSequence());
                }
                if (expectedPrevious == null || !expectedPrevious.equals(record.getPreviousHash())) {
                    return chainBreak(partition, checked, record,
                            "Previous hash " + record.getPreviousHash() + " does not match predecessor "
                                    + expectedPrevious);
                }
                RecordVerificationResult result = check(record);
                if (!result.ok()) {
                    log.error("Chain of partition {} broken at record {} (#{}): {}",
                            partition, record.getId(), record.getSequence(), result.detail());
                    return ChainVerificationResult.broken(partition, checked, record.getId(),
                            record.getSequence(), TamperReason.HASH_MISMATCH, result.detail());
                }
                expectedPrevious = record.getRecordHash();
                expectedSeq++;
                checked++;
            }
            page = slice.nextPageable();
        } while (slice.hasNext());

        if (head.isPresent() && !head.get().isEmpty()) {
            ChainHead current = head.get();
            if (expectedSeq - 1 != current.getSequence() || !current.getHeadHash().equals(expectedPrevious)) {
                String detail = "Chain ends at sequence " + (expectedSeq - 1)
                        + " but the head is at " + current.getSequence();
                log.error("Chain of partition {} broken at its head: {}", partition, detail);
                return ChainVerificationResult.broken(partition, checked, current.getHeadRecordId(),
                        current.getSequence(), TamperReason.CHAIN_BREAK, detail);
            }
        }
        log.debug("Chain of partition {} intact over {} records", partition, checked);
        return ChainVerificationResult.intact(partition, checked);
    }

    private long boundSequence(String partition, UUID recordId) {
        LedgerRecord record = findRecord(recordId);
        if (!record.getPartitionId().equals(partition)) {
            throw new IllegalArgumentException("Record " + recordId + " belongs to partition '"
                    + record.getPartitionId() + "', not '" + partition + "'");
        }
        return record.getSequence();
    }

    private ChainVerificationResult chainBreak(String partition, long checked, LedgerRecord record, String detail) {
        log.error("Chain of partition {} broken at record {} (#{}): {}",
                partition, record.getId(), record.getSequence(), detail);
        return ChainVerificationResult.broken(partition, checked, record.getId(), record.getSequence(),
                TamperReason.CHAIN_BREAK, detail);
    }

    /**
     * Recomputes the Merkle root over the record hashes currently stored for
     * the period and compares it with the anchor.
     */
    public AnchorVerificationResult verifyAnchor(String partitionId, LocalDate period) {
        String partition = partitionResolver.normalize(partitionId);
        MerkleAnchor anchor = anchorRepository.findByPartitionIdAndPeriodDate(partition, period)
                .orElseThrow(() -> new AnchorNotFoundException(partition, period));
        return check(anchor);
    }

    private AnchorVerificationResult check(MerkleAnchor anchor) {
        List<String> hashes = recordRepository.findInPeriod(anchor.getPartitionId(),
                        AnchorPeriod.start(anchor.getPeriodDate()), AnchorPeriod.end(anchor.getPeriodDate()))
                .stream()
                .map(LedgerRecord::getRecordHash)
                .toList();

        String computedRoot = null;
        try {
            computedRoot = hashes.isEmpty() ? null : MerkleTree.build(hashes).getRoot();
        } catch (IllegalArgumentException e) {
            log.error("Stored hashes of {} / {} are not valid digests: {}",
                    anchor.getPartitionId(), anchor.getPeriodDate(), e.getMessage());
        }
        boolean ok = computedRoot != null && anchor.matches(computedRoot, hashes.size());
        if (!ok) {
            log.error("Anchor mismatch for {} / {}: anchored {} ({} records), recomputed {} ({} records)",
                    anchor.getPartitionId(), anchor.getPeriodDate(), anchor.getRootHash(),
                    anchor.getRecordCount(), computedRoot, hashes.size());
        }
        return new AnchorVerificationResult(anchor.getPartitionId(), anchor.getPeriodDate(), ok,
                ok ? null : TamperReason.ANCHOR_MISMATCH, anchor.getRootHash(), computedRoot,
                anchor.getRecordCount(), hashes.size());
    }

    /**
     * Whole chain plus every anchor of the partition.
     */
    public LedgerIntegrityReport verifyLedger(String partitionId) {
        String partition = partitionResolver.normalize(partitionId);
        ChainVerificationResult chain = verifyChain(partition, null, null);
        List<AnchorVerificationResult> anchors = new ArrayList<>();
        for (MerkleAnchor anchor : anchorRepository.findByPartitionIdOrderByPeriodDateAsc(partition)) {
            anchors.add(check(anchor));
        }
        boolean ok = chain.ok() && anchors.stream().allMatch(AnchorVerificationResult::ok);
        log.info("Integrity check of partition {}: {} ({} records, {} anchors)",
                partition, ok ? "intact" : "TAMPERED", chain.recordsChecked(), anchors.size());
        return new LedgerIntegrityReport(partition, ok, chain, anchors, clock.instant());
    }

    /**
     * Shows the hash a record would need if {@code field} held {@code value}.
     */
    public TamperSimulation simulateTamper(UUID recordId, String field, Object value) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Field name is required");
        }
        LedgerRecord record = findRecord(recordId);
        FieldMap original = canonicalizer.parse(record.getPayload());

        Map<String, Object> tampered = new HashMap<>(original.toJavaMap());
        Object originalValue = tampered.remove(field);
        tampered.put(field, value);

        String tamperedHash = hasher.hash(canonicalizer.canonicalize(FieldMap.of(tampered)),
                record.getSalt(), record.getPreviousHash());
        return new TamperSimulation(recordId, field, originalValue, value, record.getRecordHash(),
                tamperedHash, !tamperedHash.equals(record.getRecordHash()));
    }

    private LedgerRecord findRecord(UUID recordId) {
        return recordRepository.findById(recordId)
                .orElseThrow(() -> new RecordNotFoundException(recordId));
    }
}
