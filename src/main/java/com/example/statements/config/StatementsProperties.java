package com.example.statements.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;

/**
 * Tunables of the statement pipeline, bound from the {@code statements.*} properties.
 *
 * @param topEntryLimit         number of entries reported in top inflow/outflow lists
 * @param commentMaxLength      maximum length of a review comment; can only lower {@link #MAX_COMMENT_LENGTH},
 *                              which bounds the request DTO and the database column
 * @param largeDebitThreshold   daily debits above this mark a large spending day
 * @param largeCreditThreshold  daily credits above this mark a large deposit
 * @param annotationWriteAttempts attempts made when concurrent first writes collide on the same key
 */
@ConfigurationProperties(prefix = "statements")
public record StatementsProperties(
        @DefaultValue("5") int topEntryLimit,
        @DefaultValue("5000") int commentMaxLength,
        @DefaultValue("5000") BigDecimal largeDebitThreshold,
        @DefaultValue("4000") BigDecimal largeCreditThreshold,
        @DefaultValue("3") int annotationWriteAttempts
) {

    public static final int MAX_COMMENT_LENGTH = 5000;

    /**
     * @return the defaults used when nothing is configured
     */
    public static StatementsProperties defaults() {
        return new StatementsProperties(5, MAX_COMMENT_LENGTH, new BigDecimal("5000"), new BigDecimal("4000"), 3);
    }
}
