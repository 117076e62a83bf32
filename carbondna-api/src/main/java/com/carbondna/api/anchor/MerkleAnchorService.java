package com.carbondna.api.anchor;

import com.carbondna.api.chain.PartitionResolver;
import com.carbondna.api.chain.RecordNotFoundException;
import com.carbondna.core.domain.LedgerRecord;
import com.carbondna.core.domain.MerkleAnchor;
import com.carbondna.core.repository.LedgerRecordRepository;
import com.carbondna.core.repository.MerkleAnchorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Closes daily periods of a partition under a Merkle root.
 *
 * <p>Anchoring is idempotent: re-running it for an anchored period returns
 * the stored anchor as long as the period's records still produce the same
 * root and count. The unique key on (partition, period) keeps concurrent
 * anchoring runs from storing two anchors.
 */
@Service
public class MerkleAnchorService {

    private static final Logger log = LoggerFactory.getLogger(MerkleAnchorService.class);

    private final LedgerRecordRepository recordRepository;
    private final MerkleAnchorRepository anchorRepository;
    private final PartitionResolver partitionResolver;
    private final Clock clock;

    public MerkleAnchorService(
            LedgerRecordRepository recordRepository,
            MerkleAnchorRepository anchorRepository,
            PartitionResolver partitionResolver,
            Clock clock) {
        this.recordRepository = recordRepository;
        this.anchorRepository = anchorRepository;
        this.partitionResolver = partitionResolver;
        this.clock = clock;
    }

    /**
     * Computes and stores the root of one closed period.
     *
     * @throws PeriodNotClosedException            if the UTC day has not ended
     * @throws EmptyPeriodException                if the partition has no records that day
     * @throws AnchorPeriodAlreadyClosedException  if an anchor exists with a different root or count
     */
    public MerkleAnchor anchorPeriod(String partitionId, LocalDate period) {
        String partition = partitionResolver.normalize(partitionId);
        if (period == null) {
            throw new IllegalArgumentException("Period date is required");
        }
        Instant now = clock.instant();
        if (!AnchorPeriod.isClosed(period, now)) {
            throw new PeriodNotClosedException(partition, period);
        }

        List<LedgerRecord> records = periodRecords(partition, period);
        if (records.isEmpty()) {
            throw new EmptyPeriodException(partition, period);
        }
        MerkleTree tree = MerkleTree.build(records.stream().map(LedgerRecord::getRecordHash).toList());

        Optional<MerkleAnchor> existing = anchorRepository.findByPartitionIdAndPeriodDate(partition, period);
        if (existing.isPresent()) {
            return confirmExisting(existing.get(), tree);
        }

        MerkleAnchor anchor = MerkleAnchor.create(
                partition,
                period,
                tree.getRoot(),
                tree.size(),
                records.get(0).getSequence(),
                records.get(records.size() - 1).getSequence(),
                now);
        try {
            anchor = anchorRepository.saveAndFlush(anchor);
        } catch (DataIntegrityViolationException e) {
            // another run stored this period first
            MerkleAnchor winner = anchorRepository.findByPartitionIdAndPeriodDate(partition, period)
                    .orElseThrow(() -> e);
            return confirmExisting(winner, tree);
        }

        log.info("Anchored {} records of partition {} for {} under root {}",
                anchor.getRecordCount(), partition, period, anchor.getRootHash());
        return anchor;
    }

    private MerkleAnchor confirmExisting(MerkleAnchor anchor, MerkleTree tree) {
        if (anchor.matches(tree.getRoot(), tree.size())) {
            log.debug("Period {} of partition {} already anchored", anchor.getPeriodDate(), anchor.getPartitionId());
            return anchor;
        }
        log.error("Re-anchoring period {} of partition {} produced root {} ({} records) but the stored anchor is {} ({} records)",
                anchor.getPeriodDate(), anchor.getPartitionId(), tree.getRoot(), tree.size(),
                anchor.getRootHash(), anchor.getRecordCount());
        throw new AnchorPeriodAlreadyClosedException(
                anchor.getPartitionId(), anchor.getPeriodDate(), anchor.getRootHash(), tree.getRoot());
    }

    /**
     * Anchors every closed, non-empty day of the partition that has no anchor
     * yet, from its first record up to yesterday (UTC). Days anchored out of
     * order, for example by hand, are skipped rather than treated as a
     * high-water mark.
     */
    public List<MerkleAnchor> anchorClosedPeriods(String partitionId) {
        String partition = partitionResolver.normalize(partitionId);
        LocalDate lastClosed = AnchorPeriod.of(clock.instant()).minusDays(1);

        Optional<LocalDate> start = recordRepository.findFirstCreatedAt(partition).map(AnchorPeriod::of);
        if (start.isEmpty()) {
            return List.of();
        }
        Set<LocalDate> anchoredDays = anchorRepository.findByPartitionIdOrderByPeriodDateAsc(partition).stream()
                .map(MerkleAnchor::getPeriodDate)
                .collect(Collectors.toSet());

        List<MerkleAnchor> anchored = new ArrayList<>();
        for (LocalDate day = start.get(); !day.isAfter(lastClosed); day = day.plusDays(1)) {
            if (anchoredDays.contains(day)
                    || recordRepository.countInPeriod(partition, AnchorPeriod.start(day), AnchorPeriod.end(day)) == 0) {
                continue;
            }
            anchored.add(anchorPeriod(partition, day));
        }
        return anchored;
    }

    @Transactional(readOnly = true)
    public List<MerkleAnchor> listAnchors(String partitionId) {
        return anchorRepository.findByPartitionIdOrderByPeriodDateAsc(partitionResolver.normalize(partitionId));
    }

    @Transactional(readOnly = true)
    public MerkleAnchor getAnchor(String partitionId, LocalDate period) {
        String partition = partitionResolver.normalize(partitionId);
        return anchorRepository.findByPartitionIdAndPeriodDate(partition, period)
                .orElseThrow(() -> new AnchorNotFoundException(partition, period));
    }

    /**
     * Builds the audit path of a record against the anchor of the day it was
     * written.
     *
     * @throws AnchorNotFoundException if that day has not been anchored yet
     */
    @Transactional(readOnly = true)
    public InclusionProof proveInclusion(UUID recordId) {
        LedgerRecord record = recordRepository.findById(recordId)
                .orElseThrow(() -> new RecordNotFoundException(recordId));
        String partition = record.getPartitionId();
        LocalDate period = AnchorPeriod.of(record.getCreatedAt());
        MerkleAnchor anchor = anchorRepository.findByPartitionIdAndPeriodDate(partition, period)
                .orElseThrow(() -> new AnchorNotFoundException(partition, period));

        List<LedgerRecord> records = periodRecords(partition, period);
        int leafIndex = -1;
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).getId().equals(recordId)) {
                leafIndex = i;
                break;
            }
        }
        if (leafIndex < 0) {
            throw new IllegalStateException("Record " + recordId + " missing from its own period " + period);
        }

        MerkleTree tree = MerkleTree.build(records.stream().map(LedgerRecord::getRecordHash).toList());
        boolean matches = anchor.matches(tree.getRoot(), tree.size());
        if (!matches) {
            log.error("Period {} of partition {} no longer reproduces anchor root {} (recomputed {})",
                    period, partition, anchor.getRootHash(), tree.getRoot());
        }
        MerkleTree.MerkleProof proof = tree.getProof(leafIndex);
        return new InclusionProof(recordId, partition, period, leafIndex, tree.size(),
                record.getRecordHash(), anchor.getRootHash(), proof.serialize(), matches);
    }

    /**
     * Checks a serialized proof against the persisted root of the given period.
     */
    @Transactional(readOnly = true)
    public InclusionVerification verifyInclusion(String serializedProof, String partitionId, LocalDate period) {
        MerkleTree.MerkleProof proof = MerkleTree.MerkleProof.deserialize(serializedProof);
        MerkleAnchor anchor = getAnchor(partitionId, period);
        boolean ok = MerkleTree.verifyProof(proof, anchor.getRootHash());
        if (!ok) {
            log.warn("Inclusion proof for leaf {} does not reach anchor root of {} / {}",
                    proof.leafHash(), anchor.getPartitionId(), period);
        }
        return new InclusionVerification(ok, anchor.getPartitionId(), period, proof.leafHash(), anchor.getRootHash());
    }

    List<LedgerRecord> periodRecords(String partition, LocalDate period) {
        return recordRepository.findInPeriod(partition, AnchorPeriod.start(period), AnchorPeriod.end(period));
    }
}
