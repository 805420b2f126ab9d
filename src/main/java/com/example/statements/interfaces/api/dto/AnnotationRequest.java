package com.example.statements.interfaces.api.dto;

import com.example.statements.config.StatementsProperties;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * API-layer DTO for a review change. The transaction is identified by its match key; {@code status} and
 * {@code comment} are optional and only supplied fields are changed.
 *
 * @param transactionDate date as shown in the review table
 * @param description     transaction description
 * @param amount          signed amount
 * @param status          {@code none} or {@code query}, {@code null} to keep the current status
 * @param comment         reviewer comment, {@code null} to keep the current comment
 */
public record AnnotationRequest(
        @NotNull String transactionDate,
        @NotNull String description,
        @NotNull BigDecimal amount,
        String status,
        @Size(max = StatementsProperties.MAX_COMMENT_LENGTH) String comment
) {
}
