package com.example.statements.domain.model;

import java.time.Instant;

/**
 * Domain DTO for a banking document of a case, as read back from the store.
 * Returned to controllers so the persistence entity never leaves the infrastructure layer.
 */
public record BankingDocument(
        Long id,
        long caseId,
        String accountHolderLabel,
        String institution,
        String accountNumber,
        String accountGroupNumber,
        String documentNumber,
        String displayName,
        boolean confirmed,
        boolean manualReview,
        int csvRowCount,
        Instant createdAt
) {

    public NumberedDocument toNumberedDocument() {
        return new NumberedDocument(accountGroupNumber, accountHolderLabel, documentNumber, createdAt);
    }
}
