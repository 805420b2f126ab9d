package com.example.statements.interfaces.api.dto;

/**
 * API-layer DTO for registering a banking document with its extraction output.
 *
 * @param canonicalXml      {@code <transaction_analysis>} XML, may be blank when extraction failed
 * @param accountHolderName account holder, blank to take it from the XML
 * @param institution       institution, blank to take it from the XML
 * @param accountNumber     account number, blank to take it from the XML
 * @param manualReview      {@code true} when AI extraction failed and a person will review the document
 */
public record RegisterDocumentRequest(
        String canonicalXml,
        String accountHolderName,
        String institution,
        String accountNumber,
        boolean manualReview
) {
}
