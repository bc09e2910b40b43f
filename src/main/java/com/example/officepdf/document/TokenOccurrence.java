package com.example.officepdf.document;

import com.example.officepdf.expression.TokenExpression;
import lombok.Value;

/**
 * One token found in one document instance. Only valid for the instance that was
 * scanned.
 */
@Value
public class TokenOccurrence {
    TokenExpression expression;
    TokenLocation location;
    /**
     * Token text exactly as it appeared, delimiters included.
     */
    String raw;
}
