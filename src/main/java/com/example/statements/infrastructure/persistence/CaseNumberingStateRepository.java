package com.example.statements.infrastructure.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the per-case numbering lock row.
 */
@Repository
public interface CaseNumberingStateRepository extends JpaRepository<CaseNumberingStateEntity, Long> {

    /**
     * Find the case row with a pessimistic write lock held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM CaseNumberingStateEntity s WHERE s.caseId = :caseId")
    Optional<CaseNumberingStateEntity> findByCaseIdForUpdate(@Param("caseId") long caseId);
}
