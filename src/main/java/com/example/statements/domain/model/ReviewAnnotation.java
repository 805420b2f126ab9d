package com.example.statements.domain.model;

import java.time.Instant;

/**
 * Domain DTO for a persisted human review of one transaction.
 * Lives independently of the canonical record and is matched back to it through {@link #key()}.
 *
 * @param id         store identifier, {@code null} before the first save
 * @param documentId owning banking document
 * @param key        composite match key
 * @param status     review status
 * @param comment    reviewer comment, never {@code null}
 * @param updatedAt  time of the last change, {@code null} before the first save
 */
public record ReviewAnnotation(
        Long id,
        long documentId,
        TransactionKey key,
        ReviewStatus status,
        String comment,
        Instant updatedAt
) {

    public ReviewAnnotation {
        status = status == null ? ReviewStatus.NONE : status;
        comment = comment == null ? "" : comment;
    }
}
