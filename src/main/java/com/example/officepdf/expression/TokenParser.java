package com.example.officepdf.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses token text into a {@link TokenExpression}.
 *
 * <pre>
 *   token    := '{{' inner '}}'
 *   inner    := main [ '?:' default ]
 *   main     := field ( '|' filter )*
 * </pre>
 *
 * The field name is trimmed; filter names are trimmed of surrounding blanks but
 * keep inner whitespace; default text is kept literally up to the closing braces.
 * Filter names are not validated here.
 */
public final class TokenParser {

    private TokenParser() {
    }

    /**
     * Parse either a complete token ({@code {{...}}}) or the text between its delimiters.
     *
     * @throws TokenParseException for malformed syntax; never any other exception
     */
    public static TokenExpression parse(String raw) {
        if (raw == null) {
            throw new TokenParseException(TokenParseException.Kind.EMPTY_FIELD, "", "Token is empty");
        }
        String inner = stripDelimiters(raw);
        if (inner.contains(TokenExpression.CLOSE)) {
            throw new TokenParseException(TokenParseException.Kind.UNBALANCED_DELIMITER, raw,
                    "Token '" + raw + "' contains a closing '}}' inside its body");
        }

        String main = inner;
        String defaultText = null;
        int question = inner.indexOf('?');
        if (question >= 0) {
            main = inner.substring(0, question);
            String rest = inner.substring(question + 1);
            if (!rest.startsWith(":")) {
                throw new TokenParseException(TokenParseException.Kind.MALFORMED_DEFAULT, raw,
                        "Token '" + raw + "' has '?' not followed by ':' (expected '?:default')");
            }
            defaultText = rest.substring(1);
        }

        List<String> parts = split(main);
        String fieldName = parts.get(0).trim();
        if (fieldName.isEmpty()) {
            throw new TokenParseException(TokenParseException.Kind.EMPTY_FIELD, raw,
                    "Token '" + raw + "' has no field name");
        }

        List<String> filters = new ArrayList<>();
        for (int i = 1; i < parts.size(); i++) {
            String filter = parts.get(i).trim();
            if (filter.isEmpty()) {
                throw new TokenParseException(TokenParseException.Kind.EMPTY_FILTER, raw,
                        "Token '" + raw + "' has an empty filter name");
            }
            filters.add(filter);
        }

        return defaultText == null
                ? TokenExpression.of(fieldName, filters)
                : TokenExpression.withDefault(fieldName, filters, defaultText);
    }

    private static String stripDelimiters(String raw) {
        if (raw.length() >= 4 && raw.startsWith(TokenExpression.OPEN) && raw.endsWith(TokenExpression.CLOSE)) {
            return raw.substring(2, raw.length() - 2);
        }
        return raw;
    }

    // String.split drops trailing empties; we need them to reject "A|upper|".
    private static List<String> split(String main) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < main.length(); i++) {
            if (main.charAt(i) == TokenExpression.FILTER_SEPARATOR) {
                parts.add(main.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(main.substring(start));
        return parts;
    }
}
