package com.example.statements.application.service;

import com.example.statements.domain.model.DocumentNumbering;
import com.example.statements.domain.model.NumberedDocument;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for account-group and document numbering.
 */
class DocumentNumberingEngineTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final DocumentNumberingEngine engine = new DocumentNumberingEngine(new DocumentNamingService());

    @Test
    void firstDocumentOfCaseIsOneDotOne() {
        DocumentNumbering numbering = engine.assign(List.of(), "John Smith", "CBA");

        assertThat(numbering).isEqualTo(new DocumentNumbering("1", "1.1"));
    }

    /**
     * Ensures the same holder reuses its group, matching names after normalization.
     */
    @Test
    void sameHolderReusesGroup() {
        List<NumberedDocument> existing = List.of(
                doc("1", "John Smith", "1.1", 0),
                doc("2", "Jane Doe", "2.1", 1),
                doc("1", "John Smith", "1.2", 2)
        );

        assertThat(engine.assign(existing, "MR JOHN SMITH", "CBA").documentNumber()).isEqualTo("1.3");
        assertThat(engine.assign(existing, "jane doe", "NAB").documentNumber()).isEqualTo("2.2");
        assertThat(engine.assign(existing, "Someone Else", "NAB").documentNumber()).isEqualTo("3.1");
    }

    /**
     * Ensures numbers grow strictly as documents are confirmed one after another.
     */
    @Test
    void sequentialConfirmationsAreMonotonic() {
        List<NumberedDocument> existing = new ArrayList<>();
        List<String> assigned = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            DocumentNumbering numbering = engine.assign(existing, "John Smith", "CBA");
            assigned.add(numbering.documentNumber());
            existing.add(doc(numbering.accountGroupNumber(), "John Smith", numbering.documentNumber(), i));
        }

        assertThat(assigned).containsExactly("1.1", "1.2", "1.3", "1.4");
    }

    /**
     * Ensures malformed document numbers fall back to creation order instead of failing.
     */
    @Test
    void malformedNumbersFallBackToCreationOrder() {
        List<NumberedDocument> existing = List.of(
                doc("1", "John Smith", "garbage", 0),
                doc("1", "John Smith", null, 1),
                doc("1", "John Smith", "1.x", 2)
        );

        assertThat(engine.assign(existing, "John Smith", "CBA").documentNumber()).isEqualTo("1.4");
        assertThat(DocumentNumberingEngine.parseSequence("3.12")).hasValue(12);
        assertThat(DocumentNumberingEngine.parseSequence("3.")).isEmpty();
    }

    @Test
    void nonNumericGroupsAreIgnoredWhenAllocating() {
        List<NumberedDocument> existing = List.of(doc("abc", "John Smith", "abc.1", 0));

        assertThat(engine.assign(existing, "Jane Doe", "CBA").documentNumber()).isEqualTo("1.1");
    }

    @Test
    void manualReviewPlaceholderUsesFreshGroup() {
        List<NumberedDocument> existing = List.of(
                doc("1", "John Smith", "1.1", 0),
                doc("2", "Jane Doe", "2.1", 1)
        );

        assertThat(engine.assignManualReviewPlaceholder(existing)).isEqualTo(new DocumentNumbering("3", "3.1"));
        assertThat(engine.assignManualReviewPlaceholder(List.of()).documentNumber()).isEqualTo("1.1");
    }

    private static NumberedDocument doc(String group, String holder, String number, int order) {
        return new NumberedDocument(group, holder, number, T0.plusSeconds(order));
    }
}
