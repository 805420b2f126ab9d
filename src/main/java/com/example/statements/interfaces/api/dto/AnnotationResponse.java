package com.example.statements.interfaces.api.dto;

import com.example.statements.domain.model.ReviewAnnotation;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * API-layer DTO for a stored review.
 */
public record AnnotationResponse(
        Long id,
        long documentId,
        String transactionDate,
        String description,
        BigDecimal amount,
        String status,
        String comment,
        Instant updatedAt
) {

    public static AnnotationResponse from(ReviewAnnotation annotation) {
        return new AnnotationResponse(
                annotation.id(),
                annotation.documentId(),
                annotation.key().date(),
                annotation.key().description(),
                annotation.key().amountValue(),
                annotation.status().name().toLowerCase(Locale.ROOT),
                annotation.comment(),
                annotation.updatedAt()
        );
    }
}
