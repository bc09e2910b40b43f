package com.example.officepdf.mapper;

import com.example.officepdf.expression.TokenExpression;
import com.example.officepdf.filter.FilterOutcome;
import com.example.officepdf.filter.FilterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a token expression and a data row into the text that replaces the token.
 *
 * Base value: the row's value for the field; the default when the field is absent
 * (or present but blank) and the token declares one; otherwise the empty string.
 * Filters then run left to right on the base value, whichever source it came from.
 */
@Component
@RequiredArgsConstructor
public class ValueResolver {
    private final FilterRegistry filterRegistry;

    /**
     * @param strict fail when the field is absent and the token has no default
     * @throws ResolveException only in strict mode, see above
     */
    public ResolvedValue resolve(TokenExpression expression, RowValues row, boolean strict) {
        Optional<String> cell = row.lookup(expression.getFieldName());
        boolean fieldPresent = cell.isPresent();
        boolean defaultUsed = false;
        String base;

        if (fieldPresent) {
            base = cell.get();
            if (expression.hasDefault() && base.isBlank()) {
                base = expression.getDefaultValue();
                defaultUsed = true;
            }
        } else if (expression.hasDefault()) {
            base = expression.getDefaultValue();
            defaultUsed = true;
        } else if (strict) {
            throw ResolveException.missingRequiredField(expression.getFieldName());
        } else {
            base = "";
        }

        List<String> warnings = new ArrayList<>();
        String value = base;
        for (String filter : expression.getFilters()) {
            FilterOutcome outcome = filterRegistry.apply(filter, value);
            value = outcome.getValue();
            if (outcome.hasWarning()) {
                warnings.add(expression.serialize() + " " + outcome.getWarning());
            }
        }
        return new ResolvedValue(value, fieldPresent, defaultUsed, List.copyOf(warnings));
    }
}
