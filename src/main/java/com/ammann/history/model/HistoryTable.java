/* (C)2026 */
package com.ammann.history.model;

import java.util.List;

/**
 * Merged result rows: each row is {@code [timestamp, cell_1, ..., cell_n]} with one cell
 * per column, in column order.
 */
public record HistoryTable(List<ResultColumn> columns, List<List<Object>> rows) {

    public HistoryTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }
}
