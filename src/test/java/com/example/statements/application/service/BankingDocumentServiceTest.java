package com.example.statements.application.service;

import com.example.statements.application.exception.DocumentNotConfirmableException;
import com.example.statements.application.service.BankingDocumentService.AccountDetails;
import com.example.statements.domain.exception.BankingDocumentNotFoundException;
import com.example.statements.domain.model.AnnotatedTransaction;
import com.example.statements.domain.model.BankingDocument;
import com.example.statements.domain.model.ReviewStatus;
import com.example.statements.domain.model.TransactionKey;
import com.example.statements.infrastructure.persistence.CaseNumberingStateRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Integration tests for registration, confirmation and re-processing of banking documents.
 */
@SpringBootTest
class BankingDocumentServiceTest {

    private static final AtomicLong CASE_IDS = new AtomicLong(100);

    @Autowired
    private BankingDocumentService documentService;

    @Autowired
    private ReviewAnnotationService annotationService;

    @Autowired
    private CaseNumberingStateRepository numberingStateRepository;

    /**
     * Ensures metadata missing from the request is taken from the extraction.
     */
    @Test
    void registerFallsBackToExtractedMetadata() throws IOException {
        BankingDocument document = documentService.register(CASE_IDS.incrementAndGet(), fixture(),
                AccountDetails.none(), false);

        assertThat(document.id()).isNotNull();
        assertThat(document.confirmed()).isFalse();
        assertThat(document.institution()).isEqualTo("Commonwealth Bank of Australia");
        assertThat(document.accountHolderLabel()).isEqualTo("MR JOHN SMITH & Jane Smith");
        assertThat(document.documentNumber()).isNull();
    }

    @Test
    void confirmAssignsNumbersDisplayNameAndRowCount() throws IOException {
        long caseId = CASE_IDS.incrementAndGet();
        BankingDocument registered = documentService.register(caseId, fixture(),
                new AccountDetails("MR JOHN SMITH", null, null), false);

        BankingDocument confirmed = documentService.confirm(registered.id(), AccountDetails.none(), false);

        assertThat(confirmed.confirmed()).isTrue();
        assertThat(confirmed.accountGroupNumber()).isEqualTo("1");
        assertThat(confirmed.documentNumber()).isEqualTo("1.1");
        assertThat(confirmed.accountHolderLabel()).isEqualTo("John Smith");
        assertThat(confirmed.displayName()).isEqualTo("1.1 CBA 5678");
        assertThat(confirmed.csvRowCount()).isEqualTo(4);
    }

    /**
     * Ensures confirming twice keeps the first numbers.
     */
    @Test
    void confirmIsIdempotent() throws IOException {
        long caseId = CASE_IDS.incrementAndGet();
        BankingDocument registered = documentService.register(caseId, fixture(),
                new AccountDetails("John Smith", "Westpac", "9999"), false);

        BankingDocument first = documentService.confirm(registered.id(), AccountDetails.none(), false);
        BankingDocument second = documentService.confirm(registered.id(),
                new AccountDetails("Someone Else", null, null), false);

        assertThat(second.documentNumber()).isEqualTo(first.documentNumber());
        assertThat(second.accountHolderLabel()).isEqualTo("John Smith");
    }

    @Test
    void holdersShareGroupsWithinCase() throws IOException {
        long caseId = CASE_IDS.incrementAndGet();
        List<String> numbers = new ArrayList<>();
        for (String holder : List.of("John Smith", "Jane Doe", "MR JOHN SMITH")) {
            BankingDocument registered = documentService.register(caseId, fixture(),
                    new AccountDetails(holder, null, null), false);
            numbers.add(documentService.confirm(registered.id(), AccountDetails.none(), false).documentNumber());
        }

        assertThat(numbers).containsExactly("1.1", "2.1", "1.2");
    }

    /**
     * Ensures concurrent confirmations in one case never receive the same number.
     */
    @Test
    void concurrentConfirmationsReceiveDistinctNumbers() throws Exception {
        long caseId = CASE_IDS.incrementAndGet();
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            ids.add(documentService.register(caseId, "", new AccountDetails("John Smith", "CBA", null), false).id());
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<String>> tasks = new ArrayList<>();
            for (Long id : ids) {
                tasks.add(() -> documentService.confirm(id, AccountDetails.none(), false).documentNumber());
            }
            List<String> numbers = new ArrayList<>();
            for (Future<String> future : executor.invokeAll(tasks)) {
                numbers.add(future.get(30, TimeUnit.SECONDS));
            }
            assertThat(numbers).containsExactlyInAnyOrder("1.1", "1.2", "1.3", "1.4");
            assertThat(numberingStateRepository.findById(caseId)).hasValueSatisfying(state -> {
                assertThat(state.getConfirmations()).isEqualTo(4);
                assertThat(state.getLastDocumentNumber()).isEqualTo("1.4");
            });
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void blankHolderWithoutManualReviewIsRejected() {
        long caseId = CASE_IDS.incrementAndGet();
        BankingDocument registered = documentService.register(caseId, "", AccountDetails.none(), false);

        assertThrows(DocumentNotConfirmableException.class,
                () -> documentService.confirm(registered.id(), AccountDetails.none(), false));
    }

    /**
     * Ensures a failed extraction under manual review gets the placeholder numbering.
     */
    @Test
    void manualReviewDocumentGetsPlaceholderInFreshGroup() throws IOException {
        long caseId = CASE_IDS.incrementAndGet();
        BankingDocument first = documentService.register(caseId, fixture(),
                new AccountDetails("John Smith", null, null), false);
        documentService.confirm(first.id(), AccountDetails.none(), false);
        BankingDocument failed = documentService.register(caseId, "", AccountDetails.none(), true);

        BankingDocument confirmed = documentService.confirm(failed.id(), AccountDetails.none(), true);

        assertThat(confirmed.documentNumber()).isEqualTo("2.1");
        assertThat(confirmed.displayName()).isEqualTo("2.1 UNKNOWN XXXX");
        assertThat(confirmed.csvRowCount()).isZero();
    }

    /**
     * Ensures reviews re-attach to the transactions of a re-generated extraction.
     */
    @Test
    void reprocessKeepsNumbersAndReviews() throws IOException {
        long caseId = CASE_IDS.incrementAndGet();
        BankingDocument registered = documentService.register(caseId, fixture(),
                new AccountDetails("John Smith", null, null), false);
        documentService.confirm(registered.id(), AccountDetails.none(), false);
        annotationService.upsert(registered.id(),
                TransactionKey.of("2024-02-03", "Woolworths Metro", new BigDecimal("-200.50")),
                ReviewStatus.QUERY, "receipt?");

        String regenerated = fixture().replace("<amount>-200.50</amount>", "<amount>-200.5</amount>");
        BankingDocument reprocessed = documentService.reprocess(registered.id(), regenerated);
        List<AnnotatedTransaction> rows = annotationService.reviewRows(registered.id());

        assertThat(reprocessed.documentNumber()).isEqualTo("1.1");
        assertThat(rows).filteredOn(AnnotatedTransaction::isQueried).singleElement()
                .satisfies(row -> {
                    assertThat(row.transaction().description()).isEqualTo("Woolworths Metro");
                    assertThat(row.comment()).isEqualTo("receipt?");
                });
    }

    /**
     * Ensures an empty re-generated extraction is still stored and clears the row count.
     */
    @Test
    void reprocessAcceptsEmptyExtraction() throws IOException {
        BankingDocument registered = documentService.register(CASE_IDS.incrementAndGet(), fixture(),
                new AccountDetails("John Smith", null, null), false);
        documentService.confirm(registered.id(), AccountDetails.none(), false);

        BankingDocument reprocessed = documentService.reprocess(registered.id(), "<transaction_analysis/>");

        assertThat(reprocessed.documentNumber()).isEqualTo("1.1");
        assertThat(reprocessed.csvRowCount()).isZero();
        assertThat(documentService.loadStatement(registered.id()).isEmpty()).isTrue();
    }

    @Test
    void unknownDocumentIsReported() {
        assertThrows(BankingDocumentNotFoundException.class, () -> documentService.getDocument(-1L));
        assertThrows(BankingDocumentNotFoundException.class,
                () -> documentService.confirm(-1L, AccountDetails.none(), false));
    }

    private String fixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/statements/sample-statement.xml")) {
            assertThat(in).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
