package com.skanga.dbgate.db;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one statement.
 *
 * @param allColumns      column labels in result-set order
 * @param allRows         rows keyed by column label, iteration order matching {@code allColumns}
 * @param rowCount        rows returned, or rows affected for an update
 * @param truncated       true when the statement produced more rows than the configured cap
 * @param executionTimeMs wall-clock time including the lease
 */
public record QueryResult(List<String> allColumns, List<Map<String, Object>> allRows, int rowCount,
                          boolean truncated, long executionTimeMs) {
    public QueryResult {
        allColumns = List.copyOf(allColumns);
        allRows = List.copyOf(allRows);
    }

    public boolean isEmpty() {
        return allRows.isEmpty();
    }
}
