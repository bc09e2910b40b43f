package com.example.officepdf.filter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of filters a token may name. The token text is bound to a constant
 * when the value is resolved; implementations are looked up in {@link FilterRegistry}.
 */
public enum FilterName {
    IDENTITY("identity"),
    TRIM("trim"),
    UPPER("upper"),
    LOWER("lower"),
    CURRENCY("currency"),
    EUROS("euros"),
    DATE("date"),
    DMY("dmy");

    private final String token;

    FilterName(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * Exact, case-sensitive match on the name written in the template.
     */
    public static Optional<FilterName> fromToken(String token) {
        return Arrays.stream(values())
                .filter(name -> name.token.equals(token))
                .findFirst();
    }
}
