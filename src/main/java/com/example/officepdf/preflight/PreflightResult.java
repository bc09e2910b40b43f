package com.example.officepdf.preflight;

import com.example.officepdf.expression.TokenExpression;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Batch-wide cross-reference of template tokens against data columns.
 */
@Value
@Builder(toBuilder = true)
public class PreflightResult {
    /**
     * Fields used without a default that no data column provides.
     */
    @Singular("missingColumn")
    Set<String> missingColumns;
    /**
     * Data columns no token refers to, reserved control columns excluded.
     */
    @Singular("unusedColumn")
    Set<String> unusedColumns;
    @Singular("templateTokens")
    Map<String, Set<TokenExpression>> perTemplateTokens;
    /**
     * Templates named by some row that do not exist in the template directory.
     */
    @Singular("missingTemplate")
    Set<String> missingTemplates;
    /**
     * Parse failures per template, as readable messages.
     */
    @Singular("parseFailure")
    Map<String, List<String>> parseFailures;

    public boolean hasMissingColumns() {
        return !missingColumns.isEmpty();
    }

    public boolean isClean() {
        return missingColumns.isEmpty() && missingTemplates.isEmpty() && parseFailures.isEmpty();
    }
}
