package com.example.statements.infrastructure.persistence;

import com.example.statements.domain.model.BankingDocument;
import com.example.statements.domain.model.DocumentNumbering;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for a banking document of a case together with its canonical extraction XML.
 * Numbering columns are written once, at confirmation, and never change afterwards.
 */
@Entity
@Table(
        name = "banking_documents",
        indexes = @Index(name = "idx_banking_documents_case", columnList = "case_id")
)
public class BankingDocumentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "case_id", nullable = false, updatable = false)
    private long caseId;

    @Lob
    @Column(name = "canonical_xml")
    private String canonicalXml;

    @Column(name = "account_holder_label")
    private String accountHolderLabel;

    @Column(name = "institution")
    private String institution;

    @Column(name = "account_number", length = 100)
    private String accountNumber;

    @Column(name = "account_group_number", length = 20)
    private String accountGroupNumber;

    @Column(name = "document_number", length = 50)
    private String documentNumber;

    @Column(name = "display_name")
    private String displayName;

    @Column(nullable = false)
    private boolean confirmed;

    @Column(name = "manual_review", nullable = false)
    private boolean manualReview;

    @Column(name = "csv_row_count", nullable = false)
    private int csvRowCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected BankingDocumentEntity() {
    }

    /**
     * Creates an unconfirmed document.
     *
     * @param caseId             owning case
     * @param canonicalXml       extractor output, may be blank for manual review documents
     * @param accountHolderLabel extracted account holder
     * @param institution        extracted institution
     * @param accountNumber      extracted account number
     * @param manualReview       {@code true} when AI extraction failed
     * @return new, not yet persisted entity
     */
    static BankingDocumentEntity register(long caseId, String canonicalXml, String accountHolderLabel,
                                          String institution, String accountNumber, boolean manualReview) {
        BankingDocumentEntity entity = new BankingDocumentEntity();
        entity.caseId = caseId;
        entity.canonicalXml = canonicalXml;
        entity.accountHolderLabel = accountHolderLabel;
        entity.institution = institution;
        entity.accountNumber = accountNumber;
        entity.manualReview = manualReview;
        return entity;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Writes the confirmation result. Can only happen once.
     *
     * @param numbering          assigned numbers
     * @param accountHolderLabel confirmed account holder
     * @param institution        confirmed institution
     * @param accountNumber      confirmed account number
     * @param displayName        formatted display name
     * @param csvRowCount        rows of the CSV projection at confirmation time
     */
    void confirm(DocumentNumbering numbering, String accountHolderLabel, String institution, String accountNumber,
                 String displayName, int csvRowCount) {
        if (confirmed) {
            throw new IllegalStateException("Banking document " + id + " is already numbered " + documentNumber);
        }
        this.accountGroupNumber = numbering.accountGroupNumber();
        this.documentNumber = numbering.documentNumber();
        this.accountHolderLabel = accountHolderLabel;
        this.institution = institution;
        this.accountNumber = accountNumber;
        this.displayName = displayName;
        this.csvRowCount = csvRowCount;
        this.confirmed = true;
    }

    /**
     * Replaces the extraction output after re-processing. Numbering and reviews are untouched.
     *
     * @param canonicalXml new extractor output
     * @param csvRowCount  rows of the new CSV projection
     */
    void replaceExtraction(String canonicalXml, int csvRowCount) {
        this.canonicalXml = canonicalXml;
        this.csvRowCount = csvRowCount;
    }

    public BankingDocument toDomain() {
        return new BankingDocument(id, caseId, accountHolderLabel, institution, accountNumber, accountGroupNumber,
                documentNumber, displayName, confirmed, manualReview, csvRowCount, createdAt);
    }

    public Long getId() {
        return id;
    }

    public long getCaseId() {
        return caseId;
    }

    public String getCanonicalXml() {
        return canonicalXml;
    }
}
