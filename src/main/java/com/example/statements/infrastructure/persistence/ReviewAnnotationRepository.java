package com.example.statements.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for review annotations.
 */
@Repository
public interface ReviewAnnotationRepository extends JpaRepository<ReviewAnnotationEntity, Long> {

    List<ReviewAnnotationEntity> findByDocumentIdOrderByIdAsc(long documentId);

    Optional<ReviewAnnotationEntity> findByDocumentIdAndMatchKeyHash(long documentId, String matchKeyHash);
}
