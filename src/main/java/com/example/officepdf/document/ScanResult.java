package com.example.officepdf.document;

import com.example.officepdf.expression.TokenExpression;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Value
public class ScanResult {
    List<TokenOccurrence> occurrences;
    List<ScanWarning> warnings;
    List<TokenParseFailure> parseFailures;

    /**
     * Distinct expressions in first-seen order.
     */
    public Set<TokenExpression> expressions() {
        return occurrences.stream()
                .map(TokenOccurrence::getExpression)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean hasParseFailures() {
        return !parseFailures.isEmpty();
    }
}
