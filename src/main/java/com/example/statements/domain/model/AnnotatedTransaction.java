package com.example.statements.domain.model;

/**
 * A statement transaction merged with its review state, as shown in the review table and query exports.
 *
 * @param rowIndex    1-based position in the date-normalized statement
 * @param transaction underlying transaction
 * @param status      review status, {@link ReviewStatus#NONE} when never reviewed
 * @param comment     reviewer comment, empty when never reviewed
 * @param sharedKey   {@code true} when another transaction in the statement has the same match key and
 *                    therefore shares this review
 */
public record AnnotatedTransaction(
        int rowIndex,
        StatementTransaction transaction,
        ReviewStatus status,
        String comment,
        boolean sharedKey
) {

    public boolean isQueried() {
        return status == ReviewStatus.QUERY;
    }
}
