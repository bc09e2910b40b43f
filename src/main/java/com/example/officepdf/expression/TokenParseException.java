package com.example.officepdf.expression;

import lombok.Getter;

/**
 * Malformed token syntax. Blocks the template that contains the token.
 */
@Getter
public class TokenParseException extends RuntimeException {

    public enum Kind {
        EMPTY_FIELD,
        EMPTY_FILTER,
        MALFORMED_DEFAULT,
        UNBALANCED_DELIMITER
    }

    private final Kind kind;
    private final String raw;

    public TokenParseException(Kind kind, String raw, String message) {
        super(message);
        this.kind = kind;
        this.raw = raw;
    }
}
