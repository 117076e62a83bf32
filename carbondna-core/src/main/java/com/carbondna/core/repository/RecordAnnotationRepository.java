package com.carbondna.core.repository;

import com.carbondna.core.domain.RecordAnnotation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface RecordAnnotationRepository extends JpaRepository<RecordAnnotation, UUID> {
}
