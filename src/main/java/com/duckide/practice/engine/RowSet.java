package com.duckide.practice.engine;

import java.util.List;

public record RowSet(List<String> columns, List<Row> rows) {
    public RowSet {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    /** What a statement without a result set, such as DML or DDL, yields. */
    public static RowSet noResultSet() {
        return new RowSet(List.of(), List.of());
    }

    /** A query always has at least one column, even when it returns no rows. */
    public boolean hasResultSet() {
        return !columns.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
