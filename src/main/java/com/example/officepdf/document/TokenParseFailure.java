package com.example.officepdf.document;

import com.example.officepdf.expression.TokenParseException;
import lombok.Value;

/**
 * A delimited token whose body does not parse. Blocks every row that uses the template.
 */
@Value
public class TokenParseFailure {
    String raw;
    TokenParseException.Kind kind;
    String message;
    int containerIndex;
    String region;

    public String describe() {
        return message + " (" + region + ")";
    }
}
