package com.example.officepdf.service;

import com.example.officepdf.datasource.DataTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Chooses the rows of a batch: an inclusive source-index range, then an optional
 * SpEL predicate evaluated with the row as root ({@code COURSE == 'A'},
 * {@code ['Full Name'] != ''}). Only property access and map indexing are allowed.
 *
 * A predicate that does not parse, or fails on any row, is ignored for the whole
 * batch with a single warning.
 */
@Slf4j
@Component
public class RowSelector {
    private final SpelExpressionParser parser = new SpelExpressionParser();

    /**
     * @return selected zero-based source indices in source order
     */
    public List<Integer> select(DataTable table, Integer fromRow, Integer toRow, String where) {
        int size = table.size();
        int from = fromRow == null ? 0 : Math.max(0, fromRow);
        int to = toRow == null ? size - 1 : Math.min(size - 1, toRow);

        List<Integer> inRange = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            inRange.add(i);
        }
        if (where == null || where.isBlank()) {
            return inRange;
        }

        Expression predicate;
        try {
            predicate = parser.parseExpression(where);
        } catch (ExpressionException e) {
            log.warn("Row filter '{}' ignored: {}", where, e.getMessage());
            return inRange;
        }

        EvaluationContext context = SimpleEvaluationContext.forPropertyAccessors(new MapAccessor()).build();
        List<Integer> selected = new ArrayList<>();
        for (Integer index : inRange) {
            Map<String, String> row = table.getRows().get(index);
            Boolean keep;
            try {
                keep = predicate.getValue(context, row, Boolean.class);
            } catch (ExpressionException e) {
                log.warn("Row filter '{}' ignored: row {}: {}", where, index, e.getMessage());
                return inRange;
            }
            if (Boolean.TRUE.equals(keep)) {
                selected.add(index);
            }
        }
        log.info("Row filter '{}' selected {} of {} rows", where, selected.size(), inRange.size());
        return selected;
    }
}
