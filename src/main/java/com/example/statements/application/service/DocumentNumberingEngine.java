package com.example.statements.application.service;

import com.example.statements.domain.model.DocumentNumbering;
import com.example.statements.domain.model.NumberedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns account-group and document numbers to a newly confirmed banking document.
 * <p>
 * Pure: the engine only looks at the numbering of the documents it is given. Callers must serialize
 * confirmations per case, otherwise two confirmations can observe the same maximum and allocate the same number.
 */
@Component
public class DocumentNumberingEngine {

    private static final Logger log = LoggerFactory.getLogger(DocumentNumberingEngine.class);
    private static final Pattern GROUP_PATTERN = Pattern.compile("\\d+");
    private static final Pattern SEQUENCE_PATTERN = Pattern.compile("^[^.]*\\.(\\d+)$");
    private static final Comparator<NumberedDocument> BY_CREATION = Comparator.comparing(
            NumberedDocument::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    private final DocumentNamingService namingService;

    public DocumentNumberingEngine(DocumentNamingService namingService) {
        this.namingService = namingService;
    }

    /**
     * Resolves the account group of the holder (reusing an existing group or allocating the next one) and the
     * next sequence inside that group.
     *
     * @param existingDocuments   numbering of the case's other banking documents
     * @param accountHolderLabel  account holder of the new document
     * @param institution         institution of the new document
     * @return assigned numbering
     */
    public DocumentNumbering assign(List<NumberedDocument> existingDocuments, String accountHolderLabel,
                                    String institution) {
        String holder = namingService.normalizeAccountHolder(accountHolderLabel);
        String group = existingGroupOf(existingDocuments, holder);
        if (group == null) {
            group = nextGroupNumber(existingDocuments);
            log.debug("Allocating account group {} for '{}' at '{}'", group, holder, institution);
        }
        int sequence = maxSequence(existingDocuments, group) + 1;
        return DocumentNumbering.of(group, sequence);
    }

    /**
     * Numbering for a document whose extraction failed and that carries no account holder: a fresh group with the
     * fixed placeholder sequence {@code 1}.
     *
     * @param existingDocuments numbering of the case's other banking documents
     * @return placeholder numbering {@code "{group}.1"}
     */
    public DocumentNumbering assignManualReviewPlaceholder(List<NumberedDocument> existingDocuments) {
        return DocumentNumbering.of(nextGroupNumber(existingDocuments), 1);
    }

    private String existingGroupOf(List<NumberedDocument> documents, String holder) {
        for (NumberedDocument document : documents) {
            if (isGroupNumber(document.accountGroupNumber())
                    && holder.equalsIgnoreCase(namingService.normalizeAccountHolder(document.accountHolderLabel()))) {
                return document.accountGroupNumber().trim();
            }
        }
        return null;
    }

    private String nextGroupNumber(List<NumberedDocument> documents) {
        long max = 0;
        for (NumberedDocument document : documents) {
            if (isGroupNumber(document.accountGroupNumber())) {
                max = Math.max(max, Long.parseLong(document.accountGroupNumber().trim()));
            }
        }
        return String.valueOf(max + 1);
    }

    /**
     * Highest sequence used in the group. Documents whose number has no parseable suffix count by their
     * position in creation order.
     */
    private int maxSequence(List<NumberedDocument> documents, String group) {
        List<NumberedDocument> members = new ArrayList<>();
        for (NumberedDocument document : documents) {
            if (document.accountGroupNumber() != null && group.equals(document.accountGroupNumber().trim())) {
                members.add(document);
            }
        }
        members.sort(BY_CREATION);

        int max = 0;
        for (int i = 0; i < members.size(); i++) {
            OptionalInt parsed = parseSequence(members.get(i).documentNumber());
            max = Math.max(max, parsed.orElse(i + 1));
        }
        return max;
    }

    static OptionalInt parseSequence(String documentNumber) {
        if (documentNumber == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = SEQUENCE_PATTERN.matcher(documentNumber.trim());
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    private static boolean isGroupNumber(String value) {
        return value != null && GROUP_PATTERN.matcher(value.trim()).matches() && value.trim().length() <= 18;
    }
}
