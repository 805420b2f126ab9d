package com.example.statements.infrastructure.persistence;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.model.ReviewAnnotation;
import com.example.statements.domain.model.ReviewStatus;
import com.example.statements.domain.model.TransactionKey;
import com.example.statements.infrastructure.exception.PersistenceConflictException;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Locale;

/**
 * Persistence component for review annotations.
 * Upserts are keyed by document and match key; each attempt runs in its own transaction so a unique-key
 * collision with a concurrent first write can be retried as an update.
 */
@Component
public class ReviewAnnotationStore {

    private static final Logger log = LoggerFactory.getLogger(ReviewAnnotationStore.class);

    private final ReviewAnnotationRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final int attempts;

    public ReviewAnnotationStore(ReviewAnnotationRepository repository,
                                 PlatformTransactionManager transactionManager,
                                 StatementsProperties properties) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.attempts = Math.max(1, properties.annotationWriteAttempts());
    }

    @Transactional(readOnly = true)
    public List<ReviewAnnotation> findByDocument(long documentId) {
        return repository.findByDocumentIdOrderByIdAsc(documentId).stream()
                .map(ReviewAnnotationEntity::toDomain)
                .toList();
    }

    /**
     * Creates or updates the annotation for a match key. Only non-null fields are changed on update.
     *
     * @param documentId owning document
     * @param key        match key
     * @param status     new status or {@code null}
     * @param comment    new comment or {@code null}
     * @return the stored annotation
     * @throws PersistenceConflictException when every attempt collided with a concurrent writer
     */
    public ReviewAnnotation upsert(long documentId, TransactionKey key, ReviewStatus status, String comment) {
        DataIntegrityViolationException lastConflict = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return transactionTemplate.execute(tx -> upsertOnce(documentId, key, status, comment));
            } catch (DataIntegrityViolationException ex) {
                if (!isMatchKeyCollision(ex)) {
                    throw ex;
                }
                lastConflict = ex;
                log.debug("Annotation write for document {} collided on attempt {}/{}", documentId, attempt, attempts);
            }
        }
        throw new PersistenceConflictException(
                "Could not save the review for document " + documentId + " after " + attempts + " attempts.",
                lastConflict);
    }

    private ReviewAnnotation upsertOnce(long documentId, TransactionKey key, ReviewStatus status, String comment) {
        ReviewAnnotationEntity entity = repository
                .findByDocumentIdAndMatchKeyHash(documentId, ReviewAnnotationEntity.matchKeyHash(key))
                .orElse(null);
        if (entity == null) {
            entity = repository.saveAndFlush(ReviewAnnotationEntity.create(documentId, key, status, comment));
            log.debug("Created review annotation {} for document {}", entity.getId(), documentId);
        } else {
            entity.apply(status, comment);
            entity = repository.saveAndFlush(entity);
        }
        return entity.toDomain();
    }

    /**
     * Only a violation of the match-key constraint means another writer created the row first; any other
     * integrity failure is not retryable.
     */
    static boolean isMatchKeyCollision(DataIntegrityViolationException ex) {
        String constraint = ReviewAnnotationEntity.MATCH_KEY_CONSTRAINT.toUpperCase(Locale.ROOT);
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation && violation.getConstraintName() != null
                    && violation.getConstraintName().toUpperCase(Locale.ROOT).contains(constraint)) {
                return true;
            }
            if (cause.getMessage() != null && cause.getMessage().toUpperCase(Locale.ROOT).contains(constraint)) {
                return true;
            }
        }
        return false;
    }
}
