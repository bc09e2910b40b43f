package com.example.officepdf.filter;

import lombok.Value;

/**
 * Value produced by a filter plus an optional soft warning explaining why the
 * input was passed through unchanged.
 */
@Value
public class FilterOutcome {
    String value;
    String warning;

    public static FilterOutcome of(String value) {
        return new FilterOutcome(value, null);
    }

    public static FilterOutcome unchanged(String value, String warning) {
        return new FilterOutcome(value, warning);
    }

    public boolean hasWarning() {
        return warning != null;
    }
}
