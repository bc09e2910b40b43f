package com.example.officepdf.datasource;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Tabular input after loading: trimmed column names in source order and one
 * string map per non-blank row. Row maps preserve column order.
 */
@Value
public class DataTable {
    String source;
    List<String> columns;
    List<Map<String, String>> rows;

    public int size() {
        return rows.size();
    }

    public boolean hasColumn(String column, boolean caseInsensitive) {
        String key = caseInsensitive ? ColumnNames.fold(column) : column;
        for (String c : columns) {
            if (key.equals(caseInsensitive ? ColumnNames.fold(c) : c)) {
                return true;
            }
        }
        return false;
    }
}
