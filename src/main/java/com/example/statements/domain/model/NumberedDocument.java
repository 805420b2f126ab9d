package com.example.statements.domain.model;

import java.time.Instant;

/**
 * Numbering metadata of a banking document that already exists in a case.
 *
 * @param accountGroupNumber case-scoped account group, may be blank for unconfirmed documents
 * @param accountHolderLabel normalized account holder label
 * @param documentNumber     {@code "{group}.{sequence}"}, may be blank or malformed
 * @param createdAt          creation time, used to order documents without a parseable sequence
 */
public record NumberedDocument(
        String accountGroupNumber,
        String accountHolderLabel,
        String documentNumber,
        Instant createdAt
) {
}
