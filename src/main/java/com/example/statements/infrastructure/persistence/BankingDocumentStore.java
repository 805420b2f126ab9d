package com.example.statements.infrastructure.persistence;

import com.example.statements.domain.exception.BankingDocumentNotFoundException;
import com.example.statements.domain.model.BankingDocument;
import com.example.statements.domain.model.DocumentNumbering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Persistence component bridging {@link BankingDocument} and {@link BankingDocumentEntity}, and owning the
 * per-case numbering lock.
 */
@Component
public class BankingDocumentStore {

    private static final Logger log = LoggerFactory.getLogger(BankingDocumentStore.class);

    private final BankingDocumentRepository documentRepository;
    private final CaseNumberingStateRepository numberingStateRepository;
    private final TransactionTemplate newTransaction;

    public BankingDocumentStore(BankingDocumentRepository documentRepository,
                                CaseNumberingStateRepository numberingStateRepository,
                                PlatformTransactionManager transactionManager) {
        this.documentRepository = documentRepository;
        this.numberingStateRepository = numberingStateRepository;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Saves a new, unconfirmed banking document.
     *
     * @return the stored document
     */
    @Transactional
    public BankingDocument register(long caseId, String canonicalXml, String accountHolderLabel, String institution,
                                    String accountNumber, boolean manualReview) {
        BankingDocumentEntity saved = documentRepository.save(BankingDocumentEntity.register(
                caseId, canonicalXml, accountHolderLabel, institution, accountNumber, manualReview));
        log.debug("Registered banking document {} in case {}", saved.getId(), caseId);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<BankingDocument> findById(long documentId) {
        return documentRepository.findById(documentId).map(BankingDocumentEntity::toDomain);
    }

    /**
     * @param documentId document id
     * @return the stored extraction XML, empty string when none was stored
     * @throws BankingDocumentNotFoundException when the id is unknown
     */
    @Transactional(readOnly = true)
    public String loadCanonicalXml(long documentId) {
        BankingDocumentEntity entity = documentRepository.findById(documentId)
                .orElseThrow(() -> new BankingDocumentNotFoundException(documentId));
        return entity.getCanonicalXml() != null ? entity.getCanonicalXml() : "";
    }

    /**
     * @param documentId document id
     * @return owning case, read without caching the document
     * @throws BankingDocumentNotFoundException when the id is unknown
     */
    @Transactional(readOnly = true)
    public long caseIdOf(long documentId) {
        return documentRepository.findCaseIdById(documentId)
                .orElseThrow(() -> new BankingDocumentNotFoundException(documentId));
    }

    @Transactional(readOnly = true)
    public List<BankingDocument> findByCase(long caseId) {
        return documentRepository.findByCaseIdOrderByCreatedAtAscIdAsc(caseId).stream()
                .map(BankingDocumentEntity::toDomain)
                .toList();
    }

    /**
     * Takes the case's numbering lock for the rest of the caller's transaction, creating the lock row on first use.
     *
     * @param caseId case whose confirmations must be serialized
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void lockCase(long caseId) {
        if (numberingStateRepository.findByCaseIdForUpdate(caseId).isPresent()) {
            return;
        }
        try {
            newTransaction.executeWithoutResult(status ->
                    numberingStateRepository.saveAndFlush(CaseNumberingStateEntity.forCase(caseId)));
        } catch (DataIntegrityViolationException ex) {
            log.debug("Numbering row for case {} was created concurrently, locking the existing row", caseId);
        }
        numberingStateRepository.findByCaseIdForUpdate(caseId)
                .orElseThrow(() -> new IllegalStateException("Numbering row for case " + caseId + " is missing"));
    }

    /**
     * Writes confirmation results. Must run inside the transaction holding the case lock.
     *
     * @return the confirmed document
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BankingDocument confirm(long documentId, DocumentNumbering numbering, String accountHolderLabel,
                                   String institution, String accountNumber, String displayName, int csvRowCount) {
        BankingDocumentEntity entity = documentRepository.findById(documentId)
                .orElseThrow(() -> new BankingDocumentNotFoundException(documentId));
        entity.confirm(numbering, accountHolderLabel, institution, accountNumber, displayName, csvRowCount);
        numberingStateRepository.findById(entity.getCaseId())
                .ifPresent(state -> state.recordConfirmation(numbering.documentNumber()));
        return entity.toDomain();
    }

    /**
     * Stores a re-generated extraction for an existing document.
     *
     * @return the updated document
     */
    @Transactional
    public BankingDocument replaceExtraction(long documentId, String canonicalXml, int csvRowCount) {
        BankingDocumentEntity entity = documentRepository.findById(documentId)
                .orElseThrow(() -> new BankingDocumentNotFoundException(documentId));
        entity.replaceExtraction(canonicalXml, csvRowCount);
        return entity.toDomain();
    }
}
