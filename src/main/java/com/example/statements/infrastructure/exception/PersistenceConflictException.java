package com.example.statements.infrastructure.exception;

/**
 * Infrastructure-layer exception raised when a write keeps colliding with concurrent writers
 * after all retries are spent.
 */
public class PersistenceConflictException extends InfrastructureException {
	/**
	 * @param message description shared with the application layer
	 * @param cause   last conflict reported by the database
	 */
    public PersistenceConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
