package com.example.officepdf.mapper;

import lombok.Getter;

/**
 * Hard resolution failure. Only raised in strict mode for a token without
 * default whose field is absent from the row.
 */
@Getter
public class ResolveException extends RuntimeException {

    public enum Kind {
        MISSING_REQUIRED_FIELD
    }

    private final Kind kind;
    private final String field;

    public ResolveException(Kind kind, String field, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
    }

    public static ResolveException missingRequiredField(String field) {
        return new ResolveException(Kind.MISSING_REQUIRED_FIELD, field,
                "Missing required field '" + field + "' (strict mode)");
    }
}
