package com.example.statements.interfaces.api;

import com.example.statements.application.exception.AnnotationValidationException;
import com.example.statements.application.service.BalanceTimelineService;
import com.example.statements.application.service.BankingDocumentService;
import com.example.statements.application.service.BankingDocumentService.AccountDetails;
import com.example.statements.application.service.CsvProjectionService;
import com.example.statements.application.service.FlowAggregationService;
import com.example.statements.application.service.ReviewAnnotationService;
import com.example.statements.domain.model.AnnotatedTransaction;
import com.example.statements.domain.model.BalanceTimeline;
import com.example.statements.domain.model.BankingDocument;
import com.example.statements.domain.model.CsvProjection;
import com.example.statements.domain.model.FlowGraph;
import com.example.statements.domain.model.FlowPeriod;
import com.example.statements.domain.model.ReviewStatus;
import com.example.statements.domain.model.ReviewStatusFilter;
import com.example.statements.domain.model.TransactionKey;
import com.example.statements.interfaces.api.dto.AnnotationRequest;
import com.example.statements.interfaces.api.dto.AnnotationResponse;
import com.example.statements.interfaces.api.dto.ConfirmDocumentRequest;
import com.example.statements.interfaces.api.dto.RegisterDocumentRequest;
import com.example.statements.interfaces.api.dto.ReprocessDocumentRequest;
import com.example.statements.interfaces.api.dto.ReviewRowResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interfaces-layer REST controller for banking documents: registration, confirmation, CSV downloads, money flows,
 * balance timelines and the review table.
 */
@RestController
@RequestMapping("/api")
public class BankingDocumentController {

    static final String ROW_COUNT_HEADER = "X-Csv-Row-Count";
    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final BankingDocumentService documentService;
    private final CsvProjectionService csvProjectionService;
    private final FlowAggregationService flowAggregationService;
    private final BalanceTimelineService timelineService;
    private final ReviewAnnotationService annotationService;

    /**
     * Creates the controller with the required application services.
     */
    public BankingDocumentController(BankingDocumentService documentService,
                                     CsvProjectionService csvProjectionService,
                                     FlowAggregationService flowAggregationService,
                                     BalanceTimelineService timelineService,
                                     ReviewAnnotationService annotationService) {
        this.documentService = documentService;
        this.csvProjectionService = csvProjectionService;
        this.flowAggregationService = flowAggregationService;
        this.timelineService = timelineService;
        this.annotationService = annotationService;
    }

    /**
     * Registers an unconfirmed banking document in a case.
     *
     * @param caseId  owning case
     * @param request extraction output and optional account details
     * @return the stored document with HTTP 201
     */
    @PostMapping(value = "/cases/{caseId}/banking-documents", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BankingDocument> register(@PathVariable long caseId,
                                                    @RequestBody RegisterDocumentRequest request) {
        BankingDocument document = documentService.register(caseId, request.canonicalXml(),
                new AccountDetails(request.accountHolderName(), request.institution(), request.accountNumber()),
                request.manualReview());
        return ResponseEntity.status(HttpStatus.CREATED).body(document);
    }

    @GetMapping(value = "/banking-documents/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public BankingDocument getDocument(@PathVariable long id) {
        return documentService.getDocument(id);
    }

    /**
     * Confirms the document and assigns its account group and document numbers.
     * The body is optional; without it the registered account details are used.
     */
    @PostMapping(value = "/banking-documents/{id}/confirm", produces = MediaType.APPLICATION_JSON_VALUE)
    public BankingDocument confirm(@PathVariable long id,
                                   @RequestBody(required = false) ConfirmDocumentRequest request) {
        if (request == null) {
            return documentService.confirm(id, AccountDetails.none(), false);
        }
        return documentService.confirm(id,
                new AccountDetails(request.accountHolderName(), request.institution(), request.accountNumber()),
                request.manualReview());
    }

    /**
     * Stores a re-generated extraction. Numbers and reviews are kept.
     */
    @PutMapping(value = "/banking-documents/{id}/extraction", produces = MediaType.APPLICATION_JSON_VALUE)
    public BankingDocument reprocess(@PathVariable long id, @Valid @RequestBody ReprocessDocumentRequest request) {
        return documentService.reprocess(id, request.canonicalXml());
    }

    /**
     * Streams the statement transactions as CSV.
     *
     * @param id document id
     * @return CSV document with the data row count in {@value #ROW_COUNT_HEADER}
     */
    @GetMapping("/banking-documents/{id}/csv")
    public ResponseEntity<byte[]> statementCsv(@PathVariable long id) {
        CsvProjection projection = csvProjectionService.project(documentService.loadStatement(id));
        return csvResponse(projection.csvText(), "statement-" + id + ".csv", projection.rowCount());
    }

    @GetMapping(value = "/banking-documents/{id}/flows", produces = MediaType.APPLICATION_JSON_VALUE)
    public FlowGraph flows(@PathVariable long id, @RequestParam(name = "period", required = false) String period) {
        FlowPeriod flowPeriod = FlowPeriod.parse(period);
        return flowAggregationService.computeFlows(documentService.loadStatement(id), flowPeriod);
    }

    @GetMapping(value = "/banking-documents/{id}/periods", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<String> periods(@PathVariable long id) {
        return flowAggregationService.availablePeriods(documentService.loadStatement(id));
    }

    @GetMapping(value = "/banking-documents/{id}/timeline", produces = MediaType.APPLICATION_JSON_VALUE)
    public BalanceTimeline timeline(@PathVariable long id,
                                    @RequestParam(name = "period", required = false) String period) {
        FlowPeriod flowPeriod = FlowPeriod.parse(period);
        return timelineService.buildTimeline(documentService.loadStatement(id), flowPeriod);
    }

    /**
     * Lists the review table rows.
     *
     * @param id     document id
     * @param status {@code all}, {@code none} or {@code query}; anything else shows all rows
     * @param search free-text filter on description, category and amount
     * @return matching rows
     */
    @GetMapping(value = "/banking-documents/{id}/transactions", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ReviewRowResponse> transactions(@PathVariable long id,
                                                @RequestParam(name = "status", required = false) String status,
                                                @RequestParam(name = "search", required = false) String search) {
        return annotationService.reviewRows(id, ReviewStatusFilter.fromString(status), search).stream()
                .map(ReviewRowResponse::from)
                .toList();
    }

    /**
     * Creates or updates the review of one transaction.
     *
     * @param id      document id
     * @param request match key plus the fields to change
     * @return the stored review
     */
    @PutMapping(value = "/banking-documents/{id}/annotations", produces = MediaType.APPLICATION_JSON_VALUE)
    public AnnotationResponse annotate(@PathVariable long id, @Valid @RequestBody AnnotationRequest request) {
        ReviewStatus status = null;
        if (request.status() != null) {
            status = ReviewStatus.fromString(request.status());
            if (status == null) {
                throw new AnnotationValidationException("Unknown review status '" + request.status() + "'.");
            }
        }
        TransactionKey key = TransactionKey.of(request.transactionDate(), request.description(), request.amount());
        return AnnotationResponse.from(annotationService.upsert(id, key, status, request.comment()));
    }

    /**
     * Streams the transactions flagged for query with their comments.
     */
    @GetMapping("/banking-documents/{id}/queries.csv")
    public ResponseEntity<byte[]> queriesCsv(@PathVariable long id) {
        List<AnnotatedTransaction> rows = annotationService.reviewRows(id, ReviewStatusFilter.QUERY, null);
        String csv = csvProjectionService.exportQueries(rows);
        return csvResponse(csv, "queries-" + id + ".csv", rows.size());
    }

    private ResponseEntity<byte[]> csvResponse(String csv, String filename, int rowCount) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .header(ROW_COUNT_HEADER, String.valueOf(rowCount))
                .contentType(TEXT_CSV)
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}
