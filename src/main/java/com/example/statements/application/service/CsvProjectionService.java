package com.example.statements.application.service;

import com.example.statements.domain.model.AnnotatedTransaction;
import com.example.statements.domain.model.CanonicalStatement;
import com.example.statements.domain.model.CsvProjection;
import com.example.statements.domain.model.StatementTransaction;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Application-layer service that turns canonical statements into downloadable CSV content.
 * Output is a pure function of its input, so repeated calls produce identical text.
 */
@Service
public class CsvProjectionService {

    public static final List<String> STATEMENT_HEADER = List.of(
            "Date", "Description", "Amount", "Balance", "Category", "Transfer_Type", "Transfer_Target");
    public static final List<String> QUERY_HEADER = List.of(
            "Row", "Date", "Description", "Amount", "Balance", "Category", "Comment");

	/**
	 * Projects every transaction of the statement into one CSV row, in date-normalized order.
	 *
	 * @param statement canonical statement
	 * @return projection whose row count always equals the number of transactions
	 */
    public CsvProjection project(CanonicalStatement statement) {
        List<StatementTransaction> transactions = statement == null ? List.of() : statement.transactions();
        List<List<String>> rows = new ArrayList<>(transactions.size());
        for (StatementTransaction transaction : transactions) {
            rows.add(List.of(
                    transaction.displayDate(),
                    transaction.description(),
                    plain(transaction.amount()),
                    plain(transaction.balance()),
                    transaction.category(),
                    transaction.transferType(),
                    transaction.transferTarget()
            ));
        }
        return new CsvProjection(STATEMENT_HEADER, List.copyOf(rows), rows.size(), buildCsv(STATEMENT_HEADER, rows));
    }

	/**
	 * Builds the CSV of transactions flagged for query, keeping their review row numbers.
	 * A statement with no flagged rows yields the header line only.
	 *
	 * @param annotatedRows reconciled review rows
	 * @return CSV document as a string
	 */
    public String exportQueries(List<AnnotatedTransaction> annotatedRows) {
        List<List<String>> rows = new ArrayList<>();
        for (AnnotatedTransaction row : annotatedRows) {
            if (!row.isQueried()) {
                continue;
            }
            StatementTransaction transaction = row.transaction();
            rows.add(List.of(
                    String.valueOf(row.rowIndex()),
                    transaction.displayDate(),
                    transaction.description(),
                    plain(transaction.amount()),
                    plain(transaction.balance()),
                    transaction.category(),
                    row.comment()
            ));
        }
        return buildCsv(QUERY_HEADER, rows);
    }

	/**
	 * Builds the CSV output including the header row and sanitized values.
	 *
	 * @param header column names
	 * @param rows   raw row values
	 * @return CSV document as a string
	 */
    private String buildCsv(List<String> header, List<List<String>> rows) {
        StringBuilder builder = new StringBuilder();
        appendLine(builder, header);
        for (List<String> row : rows) {
            appendLine(builder, row);
        }
        return builder.toString();
    }

    private void appendLine(StringBuilder builder, List<String> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(escape(values.get(i)));
        }
        builder.append('\n');
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or line breaks.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n") || sanitized.contains("\r")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }

    private static String plain(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }
}
