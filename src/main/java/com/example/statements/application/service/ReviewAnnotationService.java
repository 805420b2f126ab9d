package com.example.statements.application.service;

import com.example.statements.application.exception.AnnotationValidationException;
import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.model.AnnotatedTransaction;
import com.example.statements.domain.model.CanonicalStatement;
import com.example.statements.domain.model.ReviewAnnotation;
import com.example.statements.domain.model.ReviewStatus;
import com.example.statements.domain.model.ReviewStatusFilter;
import com.example.statements.domain.model.TransactionKey;
import com.example.statements.infrastructure.persistence.ReviewAnnotationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service for the review table: reads reconcile stored reviews onto the current extraction,
 * writes upsert a review by match key.
 */
@Service
public class ReviewAnnotationService {

    private static final Logger log = LoggerFactory.getLogger(ReviewAnnotationService.class);

    private final BankingDocumentService documentService;
    private final ReviewAnnotationStore annotationStore;
    private final ReviewReconciliationService reconciliationService;
    private final StatementsProperties properties;

    public ReviewAnnotationService(BankingDocumentService documentService,
                                   ReviewAnnotationStore annotationStore,
                                   ReviewReconciliationService reconciliationService,
                                   StatementsProperties properties) {
        this.documentService = documentService;
        this.annotationStore = annotationStore;
        this.reconciliationService = reconciliationService;
        this.properties = properties;
    }

    /**
     * @param documentId document id
     * @return every transaction of the current extraction with its review state
     */
    public List<AnnotatedTransaction> reviewRows(long documentId) {
        CanonicalStatement statement = documentService.loadStatement(documentId);
        return reconciliationService.reconcile(statement, annotationStore.findByDocument(documentId));
    }

    /**
     * @param documentId document id
     * @param status     status filter
     * @param searchTerm free-text search, may be blank
     * @return filtered review rows
     */
    public List<AnnotatedTransaction> reviewRows(long documentId, ReviewStatusFilter status, String searchTerm) {
        return reconciliationService.filter(reviewRows(documentId), status, searchTerm);
    }

    /**
     * Creates or updates the review of one transaction. Only the supplied fields change.
     *
     * @param documentId document id
     * @param key        match key of the reviewed transaction
     * @param newStatus  new status or {@code null} to keep it
     * @param newComment new comment or {@code null} to keep it
     * @return the stored review
     * @throws AnnotationValidationException when neither field is supplied or the comment is too long
     */
    public ReviewAnnotation upsert(long documentId, TransactionKey key, ReviewStatus newStatus, String newComment) {
        if (newStatus == null && newComment == null) {
            throw new AnnotationValidationException("Supply a status, a comment, or both.");
        }
        int commentLimit = Math.min(properties.commentMaxLength(), StatementsProperties.MAX_COMMENT_LENGTH);
        if (newComment != null && newComment.length() > commentLimit) {
            throw new AnnotationValidationException("Comments are limited to " + commentLimit + " characters.");
        }
        documentService.getDocument(documentId);
        ReviewAnnotation saved = annotationStore.upsert(documentId, key, newStatus, newComment);
        log.debug("Review of document {} {} set to {}", documentId, key, saved.status());
        return saved;
    }
}
