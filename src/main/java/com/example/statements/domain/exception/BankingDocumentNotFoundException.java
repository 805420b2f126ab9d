package com.example.statements.domain.exception;

/**
 * Raised when a banking document id does not resolve to a stored document.
 */
public class BankingDocumentNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing id as part of the message.
	 *
	 * @param documentId identifier that could not be resolved
	 */
    public BankingDocumentNotFoundException(long documentId) {
        super("Banking document not found: " + documentId);
    }
}
