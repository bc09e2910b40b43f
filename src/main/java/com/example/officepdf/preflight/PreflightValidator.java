package com.example.officepdf.preflight;

import com.example.officepdf.config.BatchProperties;
import com.example.officepdf.datasource.ColumnNames;
import com.example.officepdf.expression.TokenExpression;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Cross-references the tokens of every template a batch will use against the
 * data columns, once, before any row is processed.
 *
 * A field is missing when no column matches it and none of its occurrences has a
 * default. A column is unused when no token field matches it; reserved control
 * columns are never unused. Both matches follow the configured case sensitivity,
 * so a name is never reported as both missing and unused.
 */
@Slf4j
@Component
public class PreflightValidator {
    private final boolean caseInsensitive;
    private final Set<String> reservedColumns;

    @Autowired
    public PreflightValidator(BatchProperties properties) {
        this(properties.isCaseInsensitiveColumns(),
                List.of(properties.getTemplateColumn(), properties.getSkipColumn(), properties.getOutputColumn()));
    }

    public PreflightValidator(boolean caseInsensitive, Collection<String> reservedColumns) {
        this.caseInsensitive = caseInsensitive;
        this.reservedColumns = new HashSet<>();
        for (String column : reservedColumns) {
            this.reservedColumns.add(ColumnNames.fold(column));
        }
    }

    public PreflightResult validate(Map<String, ? extends Collection<TokenExpression>> perTemplateTokens,
                                    Collection<String> availableColumns) {
        Set<String> columnKeys = new HashSet<>();
        for (String column : availableColumns) {
            columnKeys.add(key(column));
        }

        // field key -> first spelling seen, and whether any occurrence has a default
        Map<String, String> fields = new LinkedHashMap<>();
        Set<String> defaulted = new HashSet<>();
        Map<String, Set<TokenExpression>> tokens = new TreeMap<>();
        perTemplateTokens.forEach((template, expressions) -> {
            tokens.put(template, new LinkedHashSet<>(expressions));
            for (TokenExpression expression : expressions) {
                String fieldKey = key(expression.getFieldName());
                fields.putIfAbsent(fieldKey, expression.getFieldName());
                if (expression.hasDefault()) {
                    defaulted.add(fieldKey);
                }
            }
        });

        PreflightResult.PreflightResultBuilder result = PreflightResult.builder().perTemplateTokens(tokens);
        fields.forEach((fieldKey, field) -> {
            if (!columnKeys.contains(fieldKey) && !defaulted.contains(fieldKey)) {
                result.missingColumn(field);
            }
        });
        for (String column : availableColumns) {
            if (!fields.containsKey(key(column)) && !reservedColumns.contains(ColumnNames.fold(column))) {
                result.unusedColumn(column);
            }
        }

        PreflightResult built = result.build();
        if (built.hasMissingColumns()) {
            log.warn("Tokens without a data column: {}", built.getMissingColumns());
        }
        if (!built.getUnusedColumns().isEmpty()) {
            log.info("Data columns not used by any template: {}", built.getUnusedColumns());
        }
        return built;
    }

    private String key(String name) {
        return caseInsensitive ? ColumnNames.fold(name) : name;
    }
}
