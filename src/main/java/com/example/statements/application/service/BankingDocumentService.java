package com.example.statements.application.service;

import com.example.statements.application.exception.DocumentNotConfirmableException;
import com.example.statements.domain.exception.BankingDocumentNotFoundException;
import com.example.statements.domain.model.BankingDocument;
import com.example.statements.domain.model.CanonicalStatement;
import com.example.statements.domain.model.DocumentNumbering;
import com.example.statements.domain.model.NumberedDocument;
import com.example.statements.infrastructure.persistence.BankingDocumentStore;
import com.example.statements.infrastructure.xml.CanonicalXmlReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Application-layer service for the lifecycle of a banking document: registration with its extraction output,
 * confirmation (numbering) and re-processing.
 */
@Service
public class BankingDocumentService {

    private static final Logger log = LoggerFactory.getLogger(BankingDocumentService.class);

    private final BankingDocumentStore documentStore;
    private final CanonicalXmlReader xmlReader;
    private final DocumentNumberingEngine numberingEngine;
    private final DocumentNamingService namingService;
    private final CsvProjectionService csvProjectionService;

    /**
     * Creates the service with its collaborators.
     *
     * @param documentStore        persistence of documents and the per-case lock
     * @param xmlReader            parser for the extractor's canonical XML
     * @param numberingEngine      numbering rules
     * @param namingService        holder label and display name rules
     * @param csvProjectionService projection used to record the row count at confirmation
     */
    public BankingDocumentService(BankingDocumentStore documentStore,
                                  CanonicalXmlReader xmlReader,
                                  DocumentNumberingEngine numberingEngine,
                                  DocumentNamingService namingService,
                                  CsvProjectionService csvProjectionService) {
        this.documentStore = documentStore;
        this.xmlReader = xmlReader;
        this.numberingEngine = numberingEngine;
        this.namingService = namingService;
        this.csvProjectionService = csvProjectionService;
    }

    /**
     * Registers an unconfirmed document. Metadata missing from the request is taken from the XML.
     *
     * @param caseId       owning case
     * @param canonicalXml extractor output, may be blank when extraction failed
     * @param metadata     account details supplied by the caller, fields may be blank
     * @param manualReview {@code true} when AI extraction failed
     * @return the stored document
     */
    public BankingDocument register(long caseId, String canonicalXml, AccountDetails metadata, boolean manualReview) {
        CanonicalStatement statement = xmlReader.read(canonicalXml);
        String holder = firstNonBlank(metadata.accountHolderName(), String.join(" & ", statement.accountHolders()));
        String institution = firstNonBlank(metadata.institution(), statement.institution());
        String accountNumber = firstNonBlank(metadata.accountNumber(), statement.accountNumber());
        return documentStore.register(caseId, canonicalXml, holder, institution, accountNumber, manualReview);
    }

    /**
     * @throws BankingDocumentNotFoundException when the id is unknown
     */
    public BankingDocument getDocument(long documentId) {
        return documentStore.findById(documentId)
                .orElseThrow(() -> new BankingDocumentNotFoundException(documentId));
    }

    /**
     * Parses the document's current extraction output.
     *
     * @param documentId document id
     * @return canonical statement, empty when the stored XML is unusable
     * @throws BankingDocumentNotFoundException when the id is unknown
     */
    public CanonicalStatement loadStatement(long documentId) {
        return xmlReader.read(documentStore.loadCanonicalXml(documentId));
    }

    /**
     * Confirms a document and assigns its numbers. Runs under the case's numbering lock, so concurrent
     * confirmations in one case observe each other's numbers. Confirming twice returns the first result.
     *
     * @param documentId   document to confirm
     * @param details      confirmed account details, blank fields fall back to the registered values
     * @param manualReview {@code true} when the reviewer confirms a document whose extraction failed
     * @return the numbered document
     * @throws DocumentNotConfirmableException when no account holder is known and the document is not under
     *                                         manual review
     */
    @Transactional
    public BankingDocument confirm(long documentId, AccountDetails details, boolean manualReview) {
        // document state must be read after the lock, never before
        documentStore.lockCase(documentStore.caseIdOf(documentId));
        BankingDocument document = getDocument(documentId);
        if (document.confirmed()) {
            log.info("Banking document {} already confirmed as {}", documentId, document.documentNumber());
            return document;
        }

        String holder = firstNonBlank(details.accountHolderName(), document.accountHolderLabel());
        String institution = firstNonBlank(details.institution(), document.institution());
        String accountNumber = firstNonBlank(details.accountNumber(), document.accountNumber());
        List<NumberedDocument> existing = documentStore.findByCase(document.caseId()).stream()
                .filter(BankingDocument::confirmed)
                .map(BankingDocument::toNumberedDocument)
                .toList();

        DocumentNumbering numbering;
        String holderLabel;
        if (holder.isBlank()) {
            if (!manualReview && !document.manualReview()) {
                throw new DocumentNotConfirmableException(
                        "An account holder is required to number banking document " + documentId + ".");
            }
            numbering = numberingEngine.assignManualReviewPlaceholder(existing);
            holderLabel = "";
        } else {
            holderLabel = namingService.normalizeAccountHolder(holder);
            numbering = numberingEngine.assign(existing, holderLabel, institution);
        }

        int rowCount = csvProjectionService.project(loadStatement(documentId)).rowCount();
        String displayName = namingService.displayName(numbering.documentNumber(), institution, accountNumber);
        BankingDocument confirmed = documentStore.confirm(documentId, numbering, holderLabel, institution,
                accountNumber, displayName, rowCount);
        log.info("Confirmed banking document {} in case {} as {} ({} rows)",
                documentId, confirmed.caseId(), numbering.documentNumber(), rowCount);
        return confirmed;
    }

    /**
     * Replaces the extraction output after re-processing. Numbers and reviews are kept; reviews re-attach to the
     * new transactions through their match keys.
     *
     * @param documentId   document id
     * @param canonicalXml new extractor output
     * @return the updated document
     */
    public BankingDocument reprocess(long documentId, String canonicalXml) {
        CanonicalStatement statement = xmlReader.read(canonicalXml);
        int rowCount = csvProjectionService.project(statement).rowCount();
        BankingDocument updated = documentStore.replaceExtraction(documentId, canonicalXml, rowCount);
        if (statement.isEmpty()) {
            log.warn("Re-processed banking document {} has neither transactions nor explicit flows", documentId);
        }
        return updated;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred.trim();
        }
        return fallback == null ? "" : fallback.trim();
    }

    /**
     * Account details entered or confirmed by a user. Any field may be blank.
     */
    public record AccountDetails(String accountHolderName, String institution, String accountNumber) {

        public static AccountDetails none() {
            return new AccountDetails(null, null, null);
        }
    }
}
