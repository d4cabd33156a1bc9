package com.memic.sdk.model;

import java.util.List;
import java.util.Map;

/**
 * Tabular output of a structured (database) search.
 *
 * @param columns column metadata, in result order
 * @param rows    result rows keyed by column name
 */
public record StructuredResult(List<ColumnInfo> columns, List<Map<String, Object>> rows) {

    public StructuredResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean hasData() {
        return !rows.isEmpty();
    }
}
