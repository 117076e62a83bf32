package com.carbondna.core.repository;

import com.carbondna.core.domain.MerkleAnchor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Merkle anchors.
 * Anchors are append-only: never updated or deleted.
 */
@Repository
public interface MerkleAnchorRepository extends JpaRepository<MerkleAnchor, UUID> {

    Optional<MerkleAnchor> findByPartitionIdAndPeriodDate(String partitionId, LocalDate periodDate);

    List<MerkleAnchor> findByPartitionIdOrderByPeriodDateAsc(String partitionId);
}
