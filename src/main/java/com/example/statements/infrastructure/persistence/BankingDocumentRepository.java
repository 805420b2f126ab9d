package com.example.statements.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for banking documents.
 */
@Repository
public interface BankingDocumentRepository extends JpaRepository<BankingDocumentEntity, Long> {

    /**
     * Lists the banking documents of a case, oldest first.
     */
    List<BankingDocumentEntity> findByCaseIdOrderByCreatedAtAscIdAsc(long caseId);

    /**
     * Resolves the owning case without loading the document into the persistence context.
     */
    @Query("SELECT d.caseId FROM BankingDocumentEntity d WHERE d.id = :id")
    Optional<Long> findCaseIdById(@Param("id") long id);
}
