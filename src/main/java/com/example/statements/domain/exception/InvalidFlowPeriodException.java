package com.example.statements.domain.exception;

/**
 * Raised when a requested period is neither {@code all} nor a {@code YYYY-MM} month.
 */
public class InvalidFlowPeriodException extends DomainException {

    public InvalidFlowPeriodException(String period) {
        super("Period must be 'all' or YYYY-MM: " + period);
    }
}
