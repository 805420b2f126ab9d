package com.example.statements.application.service;

import com.example.statements.domain.model.AnnotatedTransaction;
import com.example.statements.domain.model.CanonicalStatement;
import com.example.statements.domain.model.ReviewAnnotation;
import com.example.statements.domain.model.ReviewStatus;
import com.example.statements.domain.model.ReviewStatusFilter;
import com.example.statements.domain.model.StatementTransaction;
import com.example.statements.domain.model.TransactionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Application-layer service that merges persisted review annotations onto freshly parsed transactions.
 * Matching uses the composite {@link TransactionKey}, so reviews survive re-extraction as long as the
 * transaction's date, description and amount are reproduced.
 */
@Service
public class ReviewReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReviewReconciliationService.class);
    private static final Comparator<ReviewAnnotation> OLDEST_FIRST = Comparator.comparing(
            ReviewAnnotation::updatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    /**
     * Attaches review state to every transaction of the statement, in statement order.
     * Transactions sharing a key cannot be told apart and receive the same review; such rows are flagged.
     *
     * @param statement   canonical statement
     * @param annotations persisted annotations of the document, in any order
     * @return one row per transaction with a 1-based row index
     */
    public List<AnnotatedTransaction> reconcile(CanonicalStatement statement, List<ReviewAnnotation> annotations) {
        Map<TransactionKey, ReviewAnnotation> byKey = indexLatest(annotations);

        List<StatementTransaction> transactions = statement.transactions();
        Map<TransactionKey, Integer> occurrences = new HashMap<>();
        for (StatementTransaction transaction : transactions) {
            occurrences.merge(transaction.key(), 1, Integer::sum);
        }

        List<AnnotatedTransaction> rows = new ArrayList<>(transactions.size());
        int shared = 0;
        for (int i = 0; i < transactions.size(); i++) {
            StatementTransaction transaction = transactions.get(i);
            TransactionKey key = transaction.key();
            ReviewAnnotation annotation = byKey.get(key);
            boolean sharedKey = occurrences.get(key) > 1;
            if (sharedKey) {
                shared++;
            }
            rows.add(new AnnotatedTransaction(
                    i + 1,
                    transaction,
                    annotation != null ? annotation.status() : ReviewStatus.NONE,
                    annotation != null ? annotation.comment() : "",
                    sharedKey
            ));
        }
        if (shared > 0) {
            log.warn("{} transactions share a match key with another transaction and will share one review", shared);
        }
        return rows;
    }

    /**
     * Applies the review table filters.
     *
     * @param rows       reconciled rows
     * @param status     status filter
     * @param searchTerm case-insensitive term matched against description, category and amount; blank matches all
     * @return matching rows in their original order
     */
    public List<AnnotatedTransaction> filter(List<AnnotatedTransaction> rows, ReviewStatusFilter status,
                                             String searchTerm) {
        String term = searchTerm == null ? "" : searchTerm.trim().toLowerCase(Locale.ROOT);
        return rows.stream()
                .filter(row -> status.matches(row.status()))
                .filter(row -> term.isEmpty() || matchesSearch(row.transaction(), term))
                .toList();
    }

    private boolean matchesSearch(StatementTransaction transaction, String term) {
        return transaction.description().toLowerCase(Locale.ROOT).contains(term)
                || transaction.category().toLowerCase(Locale.ROOT).contains(term)
                || transaction.amount().toPlainString().contains(term);
    }

    private Map<TransactionKey, ReviewAnnotation> indexLatest(List<ReviewAnnotation> annotations) {
        List<ReviewAnnotation> ordered = new ArrayList<>(annotations);
        ordered.sort(OLDEST_FIRST);
        Map<TransactionKey, ReviewAnnotation> byKey = new HashMap<>();
        for (ReviewAnnotation annotation : ordered) {
            byKey.put(annotation.key(), annotation);
        }
        return byKey;
    }
}
