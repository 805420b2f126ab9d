package com.example.statements.interfaces.api.dto;

import com.example.statements.domain.model.AnnotatedTransaction;
import com.example.statements.domain.model.StatementTransaction;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * API-layer DTO for one row of the review table.
 */
public record ReviewRowResponse(
        int rowIndex,
        String date,
        String description,
        BigDecimal amount,
        BigDecimal balance,
        String category,
        String transferType,
        String transferTarget,
        String status,
        String comment,
        boolean sharedKey
) {

    public static ReviewRowResponse from(AnnotatedTransaction row) {
        StatementTransaction transaction = row.transaction();
        return new ReviewRowResponse(
                row.rowIndex(),
                transaction.displayDate(),
                transaction.description(),
                transaction.amount(),
                transaction.balance(),
                transaction.category(),
                transaction.transferType(),
                transaction.transferTarget(),
                row.status().name().toLowerCase(Locale.ROOT),
                row.comment(),
                row.sharedKey()
        );
    }
}
