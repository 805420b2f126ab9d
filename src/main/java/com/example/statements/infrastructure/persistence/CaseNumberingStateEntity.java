package com.example.statements.infrastructure.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.Instant;

/**
 * One row per case. Confirmations lock this row for the length of their transaction, which serializes
 * number assignment inside a case while different cases proceed in parallel.
 */
@Entity
@Table(name = "case_numbering_state")
public class CaseNumberingStateEntity {

    @Id
    @Column(name = "case_id", nullable = false, updatable = false)
    private Long caseId;

    @Column(name = "confirmations", nullable = false)
    private long confirmations;

    @Column(name = "last_document_number", length = 50)
    private String lastDocumentNumber;

    @Version
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected CaseNumberingStateEntity() {
    }

    static CaseNumberingStateEntity forCase(long caseId) {
        CaseNumberingStateEntity entity = new CaseNumberingStateEntity();
        entity.caseId = caseId;
        return entity;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }

    void recordConfirmation(String documentNumber) {
        confirmations++;
        lastDocumentNumber = documentNumber;
    }

    public long getConfirmations() {
        return confirmations;
    }

    public String getLastDocumentNumber() {
        return lastDocumentNumber;
    }
}
