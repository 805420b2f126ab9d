package com.example.statements.infrastructure.persistence;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.model.ReviewAnnotation;
import com.example.statements.domain.model.ReviewStatus;
import com.example.statements.domain.model.TransactionKey;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * JPA entity for a review annotation. The unique constraint on the match key makes concurrent first writes to the
 * same transaction collapse into one row.
 * <p>
 * Descriptions and raw dates have no length bound, so the constraint covers a SHA-256 digest of the key rather
 * than the key columns themselves.
 */
@Entity
@Table(
        name = "review_annotations",
        uniqueConstraints = @UniqueConstraint(
                name = ReviewAnnotationEntity.MATCH_KEY_CONSTRAINT,
                columnNames = {"document_id", "match_key_hash"}
        ),
        indexes = @Index(name = "idx_review_annotations_document", columnList = "document_id")
)
public class ReviewAnnotationEntity {

    static final String MATCH_KEY_CONSTRAINT = "uk_review_annotations_match_key";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "document_id", nullable = false, updatable = false)
    private long documentId;

    @Column(name = "match_key_hash", nullable = false, updatable = false, length = 64)
    private String matchKeyHash;

    @Lob
    @Column(name = "transaction_date", nullable = false, updatable = false)
    private String transactionDate;

    @Lob
    @Column(nullable = false, updatable = false)
    private String description;

    @Lob
    @Column(nullable = false, updatable = false)
    private String amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ReviewStatus status;

    @Column(nullable = false, length = StatementsProperties.MAX_COMMENT_LENGTH)
    private String comment;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ReviewAnnotationEntity() {
    }

    /**
     * Creates an annotation, defaulting the field the caller did not supply.
     *
     * @param documentId owning document
     * @param key        match key of the reviewed transaction
     * @param status     new status, {@code null} for {@link ReviewStatus#NONE}
     * @param comment    new comment, {@code null} for an empty comment
     * @return new, not yet persisted entity
     */
    static ReviewAnnotationEntity create(long documentId, TransactionKey key, ReviewStatus status, String comment) {
        ReviewAnnotationEntity entity = new ReviewAnnotationEntity();
        entity.documentId = documentId;
        entity.matchKeyHash = matchKeyHash(key);
        entity.transactionDate = key.date();
        entity.description = key.description();
        entity.amount = key.amount();
        entity.status = status != null ? status : ReviewStatus.NONE;
        entity.comment = comment != null ? comment : "";
        return entity;
    }

    /**
     * @param key match key
     * @return lower-case hex SHA-256 of the key's date, description and amount
     */
    static String matchKeyHash(TransactionKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            // NUL cannot appear in XML text, so the parts cannot run into each other
            String joined = key.date() + '\0' + key.description() + '\0' + key.amount();
            return HexFormat.of().formatHex(digest.digest(joined.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    @PrePersist
    void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Updates only the supplied fields.
     *
     * @param newStatus  new status or {@code null} to keep the current one
     * @param newComment new comment or {@code null} to keep the current one
     */
    void apply(ReviewStatus newStatus, String newComment) {
        if (newStatus != null) {
            this.status = newStatus;
        }
        if (newComment != null) {
            this.comment = newComment;
        }
    }

    public ReviewAnnotation toDomain() {
        return new ReviewAnnotation(id, documentId, new TransactionKey(transactionDate, description, amount),
                status, comment, updatedAt);
    }

    public Long getId() {
        return id;
    }
}
