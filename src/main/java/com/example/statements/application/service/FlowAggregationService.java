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
import com.example.statements.domain.model.FlowSummary;
import com.example.statements.domain.model.StatementTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Application-layer service computing money flows (who paid into the account, where the money went) for
 * visualization. Every chart variant goes through this one aggregation.
 */
@Service
public class FlowAggregationService {

    private static final Logger log = LoggerFactory.getLogger(FlowAggregationService.class);
    static final String OTHER_INCOME = "Other Income";
    static final String OTHER_EXPENSES = "Other Expenses";
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final StatementsProperties properties;

    public FlowAggregationService(StatementsProperties properties) {
        this.properties = properties;
    }

    /**
     * Computes the flow graph using the statement's own account label for the hub node.
     *
     * @param statement canonical statement
     * @param period    whole statement or a single month
     * @return flow graph, empty when there is nothing to show
     */
    public FlowGraph computeFlows(CanonicalStatement statement, FlowPeriod period) {
        return computeFlows(statement, period, accountNodeLabel(statement));
    }

    /**
     * Computes the flow graph.
     * For the whole statement, explicit extractor totals win over transaction aggregation when present.
     * A single month always aggregates transactions, even if the result disagrees with the explicit totals.
     *
     * @param statement    canonical statement
     * @param period       whole statement or a single month
     * @param accountLabel name of the hub node
     * @return flow graph, empty when there is nothing to show
     */
    public FlowGraph computeFlows(CanonicalStatement statement, FlowPeriod period, String accountLabel) {
        FlowSource source;
        Map<String, BigDecimal> inflows;
        Map<String, BigDecimal> outflows;
        if (period.isAll() && statement.hasExplicitFlows()) {
            source = FlowSource.EXPLICIT_TOTALS;
            inflows = statement.explicitInflows();
            outflows = statement.explicitOutflows();
        } else {
            source = FlowSource.TRANSACTIONS;
            inflows = new LinkedHashMap<>();
            outflows = new LinkedHashMap<>();
            aggregate(statement.transactions(), period, inflows, outflows);
        }

        BigDecimal totalCredits = sum(inflows);
        BigDecimal totalDebits = sum(outflows);
        FlowSummary summary = new FlowSummary(
                totalCredits,
                totalDebits,
                totalCredits.subtract(totalDebits),
                topEntries(inflows, totalCredits),
                topEntries(outflows, totalDebits)
        );

        List<FlowNode> nodes = new ArrayList<>();
        List<FlowLink> links = new ArrayList<>();
        if (!inflows.isEmpty() || !outflows.isEmpty()) {
            buildGraph(inflows, outflows, accountLabel, nodes, links);
        }
        log.debug("Computed {} flows for period {}: {} nodes, credits {}, debits {}",
                source, period.label(), nodes.size(), totalCredits, totalDebits);
        return new FlowGraph(period.label(), source, List.copyOf(nodes), List.copyOf(links), summary);
    }

    /**
     * Lists the periods a caller can ask for: {@code "all"} first, then every month that has a dated transaction.
     *
     * @param statement canonical statement
     * @return period labels
     */
    public List<String> availablePeriods(CanonicalStatement statement) {
        TreeSet<YearMonth> months = new TreeSet<>();
        for (StatementTransaction transaction : statement.transactions()) {
            transaction.yearMonth().ifPresent(months::add);
        }
        List<String> periods = new ArrayList<>(months.size() + 1);
        periods.add(FlowPeriod.ALL_LABEL);
        months.forEach(month -> periods.add(month.toString()));
        return periods;
    }

    /**
     * Builds the hub node label from the account holders (or institution) plus the account number.
     *
     * @param statement canonical statement
     * @return label for the account node
     */
    public String accountNodeLabel(CanonicalStatement statement) {
        String name = !statement.accountHolders().isEmpty()
                ? String.join(" & ", statement.accountHolders())
                : statement.institution();
        if (name.isEmpty()) {
            name = "Account";
        }
        return statement.accountNumber().isEmpty() ? name : name + "\n(" + statement.accountNumber() + ")";
    }

    private void aggregate(List<StatementTransaction> transactions, FlowPeriod period,
                           Map<String, BigDecimal> inflows, Map<String, BigDecimal> outflows) {
        for (StatementTransaction transaction : transactions) {
            if (!period.includes(transaction)) {
                continue;
            }
            if (transaction.isCredit()) {
                inflows.merge(transaction.counterpartyOr(OTHER_INCOME), transaction.amount(), BigDecimal::add);
            } else if (transaction.isDebit()) {
                outflows.merge(transaction.counterpartyOr(OTHER_EXPENSES), transaction.amount().abs(), BigDecimal::add);
            }
        }
    }

    private void buildGraph(Map<String, BigDecimal> inflows, Map<String, BigDecimal> outflows, String accountLabel,
                            List<FlowNode> nodes, List<FlowLink> links) {
        for (String source : inflows.keySet()) {
            nodes.add(new FlowNode(source, FlowNodeCategory.INFLOW));
        }
        int accountIndex = nodes.size();
        nodes.add(new FlowNode(accountLabel, FlowNodeCategory.ACCOUNT));
        for (String target : outflows.keySet()) {
            nodes.add(new FlowNode(target, FlowNodeCategory.OUTFLOW));
        }

        int index = 0;
        for (BigDecimal amount : inflows.values()) {
            links.add(new FlowLink(index++, accountIndex, amount));
        }
        index = accountIndex + 1;
        for (BigDecimal amount : outflows.values()) {
            links.add(new FlowLink(accountIndex, index++, amount));
        }
    }

    private List<FlowEntry> topEntries(Map<String, BigDecimal> flows, BigDecimal total) {
        List<Map.Entry<String, BigDecimal>> entries = new ArrayList<>(flows.entrySet());
        // stable sort keeps insertion order for equal amounts
        entries.sort(Map.Entry.<String, BigDecimal>comparingByValue(Comparator.reverseOrder()));
        return entries.stream()
                .limit(properties.topEntryLimit())
                .map(entry -> new FlowEntry(entry.getKey(), entry.getValue(), percentage(entry.getValue(), total)))
                .toList();
    }

    static BigDecimal percentage(BigDecimal amount, BigDecimal total) {
        if (total.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return amount.multiply(ONE_HUNDRED).divide(total, 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal sum(Map<String, BigDecimal> flows) {
        return flows.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
