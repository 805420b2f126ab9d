package com.example.statements.application.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.model.BalanceTimeline;
import com.example.statements.domain.model.CanonicalStatement;
import com.example.statements.domain.model.DailyBalance;
import com.example.statements.domain.model.FlowPeriod;
import com.example.statements.domain.model.StatementTransaction;
import com.example.statements.domain.model.TimelineEvent;
import com.example.statements.domain.model.TimelineEventType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BalanceTimelineServiceTest {

    private final BalanceTimelineService service = new BalanceTimelineService(StatementsProperties.defaults());

    @Test
    void groupsTransactionsByDayWithClosingBalance() {
        BalanceTimeline timeline = service.buildTimeline(statement(), FlowPeriod.ALL);

        assertThat(timeline.days()).extracting(DailyBalance::date).containsExactly(
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2), LocalDate.of(2024, 2, 1));
        DailyBalance first = timeline.days().get(0);
        assertThat(first.transactionCount()).isEqualTo(2);
        assertThat(first.credits()).isEqualByComparingTo("6000");
        assertThat(first.debits()).isEqualByComparingTo("100");
        assertThat(first.closingBalance()).isEqualByComparingTo("6900");
    }

    @Test
    void computesStatisticsFromFirstAndLastDay() {
        BalanceTimeline timeline = service.buildTimeline(statement(), FlowPeriod.ALL);

        assertThat(timeline.statistics().startingBalance()).isEqualByComparingTo("1000");
        assertThat(timeline.statistics().endingBalance()).isEqualByComparingTo("-600");
        assertThat(timeline.statistics().totalCredits()).isEqualByComparingTo("6000");
        assertThat(timeline.statistics().totalDebits()).isEqualByComparingTo("7600");
        assertThat(timeline.statistics().transactionCount()).isEqualTo(4);
    }

    /**
     * Ensures large deposits, large spending and going negative are reported.
     */
    @Test
    void detectsKeyEvents() {
        BalanceTimeline timeline = service.buildTimeline(statement(), FlowPeriod.ALL);

        assertThat(timeline.events()).extracting(TimelineEvent::type).containsExactly(
                TimelineEventType.LARGE_DEPOSIT, TimelineEventType.WENT_NEGATIVE, TimelineEventType.LARGE_SPENDING);
        assertThat(timeline.events().get(1).label()).isEqualTo("Account went negative");
        assertThat(timeline.events().get(1).date()).isEqualTo(LocalDate.of(2024, 1, 2));
    }

    @Test
    void monthPeriodRestrictsDaysOnly() {
        BalanceTimeline timeline = service.buildTimeline(statement(), FlowPeriod.parse("2024-02"));

        assertThat(timeline.period()).isEqualTo("2024-02");
        assertThat(timeline.days()).hasSize(1);
        assertThat(timeline.statistics().transactionCount()).isEqualTo(4);
    }

    @Test
    void emptyStatementYieldsEmptyTimeline() {
        BalanceTimeline timeline = service.buildTimeline(CanonicalStatement.empty(), FlowPeriod.ALL);

        assertThat(timeline.days()).isEmpty();
        assertThat(timeline.events()).isEmpty();
        assertThat(timeline.statistics().endingBalance()).isEqualByComparingTo("0");
    }

    private CanonicalStatement statement() {
        List<StatementTransaction> transactions = List.of(
                tx(LocalDate.of(2024, 1, 1), "Salary", "6000", "7000"),
                tx(LocalDate.of(2024, 1, 1), "Coffee", "-100", "6900"),
                tx(LocalDate.of(2024, 1, 2), "Car", "-7000", "-100"),
                tx(LocalDate.of(2024, 2, 1), "Rent", "-500", "-600")
        );
        return new CanonicalStatement(null, null, null, null, null, null, null, null, null, null,
                transactions, null, null, null);
    }

    private static StatementTransaction tx(LocalDate date, String description, String amount, String balance) {
        return new StatementTransaction(date.toString(), date, description, new BigDecimal(amount),
                new BigDecimal(balance), "", "", "");
    }
}
