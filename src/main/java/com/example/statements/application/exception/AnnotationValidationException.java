package com.example.statements.application.exception;

/**
 * Thrown when a review annotation change cannot be applied because of caller mistakes,
 * such as a change with neither status nor comment, or an oversized comment.
 */
public class AnnotationValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public AnnotationValidationException(String message) {
        super(message);
    }
}
