package com.example.statements.interfaces.api.dto;

/**
 * API-layer DTO carrying the account details a user confirmed. Blank fields keep the registered values.
 */
public record ConfirmDocumentRequest(
        String accountHolderName,
        String institution,
        String accountNumber,
        boolean manualReview
) {
}
