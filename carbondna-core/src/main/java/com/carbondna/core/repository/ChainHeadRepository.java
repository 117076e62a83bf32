package com.carbondna.core.repository;

import com.carbondna.core.domain.ChainHead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for partition chain heads.
 */
@Repository
public interface ChainHeadRepository extends JpaRepository<ChainHead, String> {

    @Query("SELECT h.partitionId FROM ChainHead h ORDER BY h.partitionId")
    List<String> findAllPartitionIds();
}
