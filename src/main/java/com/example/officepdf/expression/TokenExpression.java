package com.example.officepdf.expression;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parsed form of a {@code {{field|filter|...?:default}}} token.
 *
 * Filter names are kept exactly as written; they are bound to
 * {@link com.example.officepdf.filter.FilterName} only when a value is resolved,
 * so a misspelled filter still lets preflight reason about the field.
 *
 * Two expressions are equal when their serialized forms are equal.
 */
public final class TokenExpression {
    public static final String OPEN = "{{";
    public static final String CLOSE = "}}";
    static final char FILTER_SEPARATOR = '|';
    static final String DEFAULT_MARKER = "?:";

    private final String fieldName;
    private final List<String> filters;
    private final boolean hasDefault;
    private final String defaultValue;
    private final String serialized;

    private TokenExpression(String fieldName, List<String> filters, boolean hasDefault, String defaultValue) {
        this.fieldName = fieldName;
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
        this.hasDefault = hasDefault;
        this.defaultValue = hasDefault ? defaultValue : "";
        this.serialized = buildSerialized();
    }

    public static TokenExpression of(String fieldName, List<String> filters) {
        return new TokenExpression(fieldName, filters, false, "");
    }

    public static TokenExpression withDefault(String fieldName, List<String> filters, String defaultValue) {
        return new TokenExpression(fieldName, filters, true, Objects.requireNonNull(defaultValue));
    }

    public String getFieldName() {
        return fieldName;
    }

    public List<String> getFilters() {
        return filters;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    /**
     * Canonical token text, e.g. {@code {{Name|trim|upper?:N/A}}}.
     */
    @JsonValue
    public String serialize() {
        return serialized;
    }

    private String buildSerialized() {
        StringBuilder sb = new StringBuilder(OPEN).append(fieldName);
        for (String filter : filters) {
            sb.append(FILTER_SEPARATOR).append(filter);
        }
        if (hasDefault) {
            sb.append(DEFAULT_MARKER).append(defaultValue);
        }
        return sb.append(CLOSE).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenExpression)) return false;
        return serialized.equals(((TokenExpression) o).serialized);
    }

    @Override
    public int hashCode() {
        return serialized.hashCode();
    }

    @Override
    public String toString() {
        return serialized;
    }
}
