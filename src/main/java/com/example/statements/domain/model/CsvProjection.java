package com.example.statements.domain.model;

import java.util.List;

/**
 * Flat tabular view derived from a canonical statement.
 *
 * @param header   fixed column names
 * @param rows     one row of raw (unescaped) values per transaction
 * @param rowCount number of data rows, always equal to {@code rows.size()}
 * @param csvText  rendered CSV document including the header line
 */
public record CsvProjection(
        List<String> header,
        List<List<String>> rows,
        int rowCount,
        String csvText
) {
}
