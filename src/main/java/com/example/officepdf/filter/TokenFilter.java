package com.example.officepdf.filter;

/**
 * A pure string transformation applied to a resolved token value.
 * Implementations must not throw: input they cannot handle is returned
 * unchanged with a warning.
 */
@FunctionalInterface
public interface TokenFilter {
    FilterOutcome apply(String value);
}
