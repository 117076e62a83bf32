package com.carbondna.core.repository;

import com.carbondna.core.domain.LedgerRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ledger records.
 * Append-only: callers insert records and never update or delete them.
 */
@Repository
public interface LedgerRecordRepository extends JpaRepository<LedgerRecord, UUID> {

    /**
     * Records of a partition in chain order.
     */
    Page<LedgerRecord> findByPartitionIdOrderBySequenceAsc(String partitionId, Pageable pageable);

    /**
     * A window of the chain, used by chain verification to walk large partitions page by page.
     */
    Slice<LedgerRecord> findByPartitionIdAndSequenceBetweenOrderBySequenceAsc(
            String partitionId, long fromSequence, long toSequence, Pageable pageable);

    Optional<LedgerRecord> findByPartitionIdAndSequence(String partitionId, long sequence);

    /**
     * Records created in a half-open time window, in chain order (Merkle leaves of a period).
     */
    @Query("SELECT r FROM LedgerRecord r WHERE r.partitionId = :partitionId "
            + "AND r.createdAt >= :start AND r.createdAt < :end ORDER BY r.sequence ASC")
    List<LedgerRecord> findInPeriod(
            @Param("partitionId") String partitionId,
            @Param("start") Instant start,
            @Param("end") Instant end);

    @Query("SELECT COUNT(r) FROM LedgerRecord r WHERE r.partitionId = :partitionId "
            + "AND r.createdAt >= :start AND r.createdAt < :end")
    long countInPeriod(
            @Param("partitionId") String partitionId,
            @Param("start") Instant start,
            @Param("end") Instant end);

    /**
     * Earliest creation instant in a partition (start of anchoring catch-up).
     */
    @Query("SELECT MIN(r.createdAt) FROM LedgerRecord r WHERE r.partitionId = :partitionId")
    Optional<Instant> findFirstCreatedAt(@Param("partitionId") String partitionId);

    boolean existsByRecordHash(String recordHash);

    boolean existsBySupersedesId(UUID supersedesId);

    Optional<LedgerRecord> findBySupersedesId(UUID supersedesId);

    long countByPartitionId(String partitionId);
}
