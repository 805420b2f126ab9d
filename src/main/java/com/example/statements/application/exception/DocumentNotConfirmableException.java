package com.example.statements.application.exception;

/**
 * Thrown when a confirmation request lacks the account holder needed to number a document
 * and the document is not flagged for manual review.
 */
public class DocumentNotConfirmableException extends ApplicationException {

    public DocumentNotConfirmableException(String message) {
        super(message);
    }
}
