package com.example.officepdf.mapper;

import com.example.officepdf.datasource.ColumnNames;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One data row: column name to stringified cell value, read-only.
 *
 * With case-insensitive matching an exact column match still wins; otherwise the
 * first column (in source order) whose name equals ignoring case is used.
 */
public final class RowValues {
    private final Map<String, String> values;
    private final Map<String, String> folded;

    private RowValues(Map<String, String> values, boolean caseInsensitive) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        if (caseInsensitive) {
            Map<String, String> index = new HashMap<>();
            values.forEach((column, value) -> index.putIfAbsent(ColumnNames.fold(column), value));
            this.folded = index;
        } else {
            this.folded = null;
        }
    }

    public static RowValues of(Map<String, String> values, boolean caseInsensitive) {
        return new RowValues(values, caseInsensitive);
    }

    public static RowValues of(Map<String, String> values) {
        return new RowValues(values, true);
    }

    public Optional<String> lookup(String column) {
        if (column == null) {
            return Optional.empty();
        }
        if (values.containsKey(column)) {
            return Optional.ofNullable(values.get(column));
        }
        if (folded != null) {
            return Optional.ofNullable(folded.get(ColumnNames.fold(column)));
        }
        return Optional.empty();
    }

    public boolean isCaseInsensitive() {
        return folded != null;
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
