package com.example.statements.application.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.model.CanonicalStatement;
import com.example.statements.domain.model.FlowEntry;
import com.example.statements.domain.model.FlowGraph;
import com.example.statements.domain.model.FlowLink;
import com.example.statements.domain.model.FlowNode;
import com.example.statements.domain.model.FlowNodeCategory;
import com.example.statements.domain.model.FlowPeriod;
import com.example.statements.domain.model.FlowSource;
import com.example.statements.domain.model.StatementTransaction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the flow aggregation rules.
 */
class FlowAggregationServiceTest {

    private final FlowAggregationService service = new FlowAggregationService(StatementsProperties.defaults());

    @Test
    void aggregatesTransactionsByCounterparty() {
        CanonicalStatement statement = statement(List.of(
                tx("2024-01-05", "Salary", "5000", "Income", ""),
                tx("2024-01-10", "Rent", "-2000", "", "Landlord"),
                tx("2024-01-15", "Transfer to xx1234", "-500", "", "xx1234")
        ), Map.of(), Map.of());

        FlowGraph graph = service.computeFlows(statement, FlowPeriod.ALL);

        assertThat(graph.source()).isEqualTo(FlowSource.TRANSACTIONS);
        assertThat(graph.summary().totalCredits()).isEqualByComparingTo("5000");
        assertThat(graph.summary().totalDebits()).isEqualByComparingTo("2500");
        assertThat(graph.summary().netPosition()).isEqualByComparingTo("2500");
        assertThat(graph.nodes()).extracting(FlowNode::name)
                .containsExactly("Income", "Account", "Landlord", "xx1234");
        assertThat(graph.nodes()).extracting(FlowNode::category).containsExactly(
                FlowNodeCategory.INFLOW, FlowNodeCategory.ACCOUNT, FlowNodeCategory.OUTFLOW, FlowNodeCategory.OUTFLOW);
        assertThat(graph.links()).hasSize(3);
        assertThat(graph.links().get(0).source()).isZero();
        assertThat(graph.links().get(0).target()).isEqualTo(1);
        assertThat(graph.links().get(2).source()).isEqualTo(1);
        assertThat(graph.links().get(2).target()).isEqualTo(3);
    }

    /**
     * Ensures explicit totals win for the whole statement even when transactions disagree.
     */
    @Test
    void explicitTotalsTakePrecedenceForWholeStatement() {
        Map<String, BigDecimal> inflows = ordered("Employer", "6000");
        Map<String, BigDecimal> outflows = ordered("Landlord", "2000");
        CanonicalStatement statement = statement(List.of(
                tx("2024-01-05", "Salary", "5000", "Income", "")
        ), inflows, outflows);

        FlowGraph graph = service.computeFlows(statement, FlowPeriod.ALL);

        assertThat(graph.source()).isEqualTo(FlowSource.EXPLICIT_TOTALS);
        assertThat(graph.summary().totalCredits()).isEqualByComparingTo("6000");
        assertThat(graph.nodes()).extracting(FlowNode::name).containsExactly("Employer", "Account", "Landlord");
    }

    /**
     * Ensures a month period ignores explicit totals and only counts that month's transactions.
     */
    @Test
    void monthPeriodAggregatesTransactionsOfThatMonth() {
        CanonicalStatement statement = statement(List.of(
                tx("2024-01-05", "Salary", "5000", "Income", ""),
                tx("2024-02-05", "Salary", "5100", "Income", ""),
                tx("not a date", "Fee", "-10", "Fees", "")
        ), ordered("Employer", "10100"), Map.of());

        FlowGraph graph = service.computeFlows(statement, FlowPeriod.parse("2024-02"));

        assertThat(graph.source()).isEqualTo(FlowSource.TRANSACTIONS);
        assertThat(graph.period()).isEqualTo("2024-02");
        assertThat(graph.summary().totalCredits()).isEqualByComparingTo("5100");
        assertThat(graph.summary().totalDebits()).isEqualByComparingTo("0");
    }

    @Test
    void emptyStatementYieldsEmptyGraphAndZeroTotals() {
        FlowGraph graph = service.computeFlows(CanonicalStatement.empty(), FlowPeriod.ALL);

        assertThat(graph.nodes()).isEmpty();
        assertThat(graph.links()).isEmpty();
        assertThat(graph.summary().totalCredits()).isEqualByComparingTo("0");
        assertThat(graph.summary().largestInflow()).isNull();
        assertThat(graph.summary().largestOutflow()).isNull();
    }

    /**
     * Ensures percentages never divide by zero.
     */
    @Test
    void zeroTotalYieldsZeroPercent() {
        assertThat(FlowAggregationService.percentage(BigDecimal.TEN, BigDecimal.ZERO)).isEqualByComparingTo("0");
        assertThat(FlowAggregationService.percentage(new BigDecimal("1"), new BigDecimal("3")))
                .isEqualByComparingTo("33.33");
    }

    /**
     * Ensures the top lists hold the five largest entries with ties kept in insertion order.
     */
    @Test
    void topEntriesAreLimitedAndTiesKeepInsertionOrder() {
        List<StatementTransaction> transactions = new ArrayList<>();
        String[] targets = {"A", "B", "C", "D", "E", "F", "G"};
        String[] amounts = {"-100", "-300", "-100", "-50", "-300", "-20", "-10"};
        for (int i = 0; i < targets.length; i++) {
            transactions.add(tx("2024-03-0" + (i + 1), "Payment " + i, amounts[i], "", targets[i]));
        }

        FlowGraph graph = service.computeFlows(statement(transactions, Map.of(), Map.of()), FlowPeriod.ALL);

        assertThat(graph.summary().topOutflows()).extracting(FlowEntry::label)
                .containsExactly("B", "E", "A", "C", "D");
        assertThat(graph.summary().largestOutflow().label()).isEqualTo("B");
        assertThat(graph.summary().largestOutflow().percentage()).isEqualByComparingTo("34.09");
    }

    /**
     * Ensures link weights into and out of the account add up to the reported totals.
     */
    @Test
    void linkWeightsMatchTotals() {
        CanonicalStatement statement = statement(List.of(
                tx("2024-01-05", "Salary", "5000", "Income", ""),
                tx("2024-01-06", "Refund", "25.50", "", ""),
                tx("2024-01-10", "Rent", "-2000", "", "Landlord"),
                tx("2024-01-11", "Rent top-up", "-150", "", "Landlord"),
                tx("2024-01-12", "Misc", "-9.99", "", "")
        ), Map.of(), Map.of());

        FlowGraph graph = service.computeFlows(statement, FlowPeriod.ALL);
        int account = graph.nodes().indexOf(new FlowNode("Account", FlowNodeCategory.ACCOUNT));

        BigDecimal in = graph.links().stream().filter(link -> link.target() == account)
                .map(FlowLink::value).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal out = graph.links().stream().filter(link -> link.source() == account)
                .map(FlowLink::value).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(in).isEqualByComparingTo(graph.summary().totalCredits());
        assertThat(out).isEqualByComparingTo(graph.summary().totalDebits());
        assertThat(graph.nodes()).extracting(FlowNode::name)
                .containsExactly("Income", FlowAggregationService.OTHER_INCOME, "Account",
                        "Landlord", FlowAggregationService.OTHER_EXPENSES);
    }

    /**
     * Ensures repeated computation over the same statement yields equal graphs for both flow sources.
     */
    @Test
    void computeFlowsIsIdempotent() {
        CanonicalStatement statement = statement(List.of(
                tx("2024-01-05", "Salary", "5000", "Income", ""),
                tx("2024-01-10", "Rent", "-2000", "", "Landlord"),
                tx("2024-02-03", "Groceries", "-120.40", "Food", "Woolworths")
        ), ordered("Employer", "5000"), ordered("Landlord", "2000"));

        FlowGraph firstAll = service.computeFlows(statement, FlowPeriod.ALL);
        FlowGraph secondAll = service.computeFlows(statement, FlowPeriod.ALL);
        FlowGraph firstMonth = service.computeFlows(statement, FlowPeriod.parse("2024-01"));
        FlowGraph secondMonth = service.computeFlows(statement, FlowPeriod.parse("2024-01"));

        assertThat(firstAll.source()).isEqualTo(FlowSource.EXPLICIT_TOTALS);
        assertThat(secondAll).isEqualTo(firstAll);
        assertThat(firstMonth.source()).isEqualTo(FlowSource.TRANSACTIONS);
        assertThat(secondMonth).isEqualTo(firstMonth);
    }

    @Test
    void availablePeriodsListAllFirstThenMonthsAscending() {
        CanonicalStatement statement = statement(List.of(
                tx("2024-03-01", "c", "1", "", ""),
                tx("2024-01-01", "a", "1", "", ""),
                tx("2024-01-20", "b", "1", "", ""),
                tx("garbage", "d", "1", "", "")
        ), Map.of(), Map.of());

        assertThat(service.availablePeriods(statement)).containsExactly("all", "2024-01", "2024-03");
    }

    @Test
    void accountNodeLabelUsesHoldersAndAccountNumber() {
        CanonicalStatement statement = new CanonicalStatement("CBA", List.of("John Smith", "Jane Smith"), null,
                null, null, "1234", null, null, null, null, null, null, null, null);

        assertThat(service.accountNodeLabel(statement)).isEqualTo("John Smith & Jane Smith\n(1234)");
    }

    static StatementTransaction tx(String date, String description, String amount, String category, String target) {
        LocalDate parsed = date.matches("\\d{4}-\\d{2}-\\d{2}") ? LocalDate.parse(date) : null;
        return new StatementTransaction(date, parsed, description, new BigDecimal(amount), null, category, "", target);
    }

    private static CanonicalStatement statement(List<StatementTransaction> transactions,
                                                Map<String, BigDecimal> inflows,
                                                Map<String, BigDecimal> outflows) {
        return new CanonicalStatement(null, null, null, null, null, null, null, null, null, null,
                transactions, inflows, outflows, null);
    }

    private static Map<String, BigDecimal> ordered(String label, String amount) {
        Map<String, BigDecimal> flows = new LinkedHashMap<>();
        flows.put(label, new BigDecimal(amount));
        return flows;
    }
}
