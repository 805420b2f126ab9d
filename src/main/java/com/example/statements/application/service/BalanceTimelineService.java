package com.example.statements.application.service;

import com.example.statements.config.StatementsProperties;
import com.example.statements.domain.model.BalanceTimeline;
import com.example.statements.domain.model.CanonicalStatement;
import com.example.statements.domain.model.DailyBalance;
import com.example.statements.domain.model.FlowPeriod;
import com.example.statements.domain.model.StatementTransaction;
import com.example.statements.domain.model.TimelineEvent;
import com.example.statements.domain.model.TimelineEventType;
import com.example.statements.domain.model.TimelineStatistics;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application-layer service that turns a statement into a daily balance series with key events.
 */
@Service
public class BalanceTimelineService {

    private final StatementsProperties properties;

    public BalanceTimelineService(StatementsProperties properties) {
        this.properties = properties;
    }

    /**
     * Builds the timeline. The period only restricts the daily points; statistics and events always describe
     * the whole statement.
     *
     * @param statement canonical statement
     * @param period    whole statement or a single month
     * @return timeline, with empty lists and zero statistics for a statement without dated transactions
     */
    public BalanceTimeline buildTimeline(CanonicalStatement statement, FlowPeriod period) {
        List<DailyBalance> days = dailyBalances(statement.transactions());
        TimelineStatistics statistics = statistics(statement.transactions(), days);
        List<TimelineEvent> events = detectEvents(days, statistics.startingBalance());

        List<DailyBalance> visible = period.isAll()
                ? days
                : days.stream().filter(day -> YearMonth.from(day.date()).equals(period.month())).toList();
        return new BalanceTimeline(period.label(), List.copyOf(visible), statistics, List.copyOf(events));
    }

    private List<DailyBalance> dailyBalances(List<StatementTransaction> transactions) {
        Map<LocalDate, DayTotals> byDay = new LinkedHashMap<>();
        for (StatementTransaction transaction : transactions) {
            if (transaction.date() == null) {
                continue;
            }
            byDay.computeIfAbsent(transaction.date(), date -> new DayTotals()).add(transaction);
        }

        List<DailyBalance> days = new ArrayList<>(byDay.size());
        BigDecimal carried = null;
        for (Map.Entry<LocalDate, DayTotals> entry : byDay.entrySet()) {
            DayTotals totals = entry.getValue();
            BigDecimal closing = totals.lastBalance != null ? totals.lastBalance : carried;
            carried = closing;
            days.add(new DailyBalance(entry.getKey(), totals.credits, totals.debits, closing,
                    totals.credits.subtract(totals.debits), totals.count));
        }
        return days;
    }

    private TimelineStatistics statistics(List<StatementTransaction> transactions, List<DailyBalance> days) {
        if (transactions.isEmpty()) {
            return TimelineStatistics.empty();
        }
        BigDecimal credits = BigDecimal.ZERO;
        BigDecimal debits = BigDecimal.ZERO;
        for (StatementTransaction transaction : transactions) {
            if (transaction.isCredit()) {
                credits = credits.add(transaction.amount());
            } else if (transaction.isDebit()) {
                debits = debits.add(transaction.amount().abs());
            }
        }

        BigDecimal starting = BigDecimal.ZERO;
        BigDecimal ending = BigDecimal.ZERO;
        if (!days.isEmpty()) {
            DailyBalance first = days.get(0);
            DailyBalance last = days.get(days.size() - 1);
            if (first.closingBalance() != null) {
                starting = first.closingBalance().subtract(first.netChange());
            }
            if (last.closingBalance() != null) {
                ending = last.closingBalance();
            }
        }
        return new TimelineStatistics(starting, ending, credits, debits, credits.subtract(debits), transactions.size());
    }

    private List<TimelineEvent> detectEvents(List<DailyBalance> days, BigDecimal startingBalance) {
        List<TimelineEvent> events = new ArrayList<>();
        BigDecimal previous = startingBalance;
        for (DailyBalance day : days) {
            BigDecimal balance = day.closingBalance();
            if (balance != null) {
                if (previous.signum() >= 0 && balance.signum() < 0) {
                    events.add(TimelineEvent.of(day.date(), TimelineEventType.WENT_NEGATIVE, balance));
                }
                previous = balance;
            }
            if (day.debits().compareTo(properties.largeDebitThreshold()) > 0) {
                events.add(TimelineEvent.of(day.date(), TimelineEventType.LARGE_SPENDING, balance));
            }
            if (day.credits().compareTo(properties.largeCreditThreshold()) > 0) {
                events.add(TimelineEvent.of(day.date(), TimelineEventType.LARGE_DEPOSIT, balance));
            }
        }
        return events;
    }

    private static final class DayTotals {
        private BigDecimal credits = BigDecimal.ZERO;
        private BigDecimal debits = BigDecimal.ZERO;
        private BigDecimal lastBalance;
        private int count;

        void add(StatementTransaction transaction) {
            if (transaction.isCredit()) {
                credits = credits.add(transaction.amount());
            } else if (transaction.isDebit()) {
                debits = debits.add(transaction.amount().abs());
            }
            if (transaction.balance() != null) {
                lastBalance = transaction.balance();
            }
            count++;
        }
    }
}
