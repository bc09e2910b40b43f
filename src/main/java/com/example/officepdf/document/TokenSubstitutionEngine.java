package com.example.officepdf.document;

import com.example.officepdf.expression.TokenExpression;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Replaces scanned tokens with resolved values in place.
 *
 * Within a container occurrences are applied last to first so that the span
 * coordinates of the ones still pending stay valid. For a token spread over
 * several spans the first span takes the value (keeping its prefix), the spans in
 * between are emptied and the last keeps only its suffix. Spans left empty are
 * removed when they carry nothing but text; the first span is always kept so the
 * value keeps its formatting.
 */
@Slf4j
@Component
public class TokenSubstitutionEngine {

    private static final Comparator<TokenOccurrence> BY_POSITION = Comparator
            .comparingInt((TokenOccurrence o) -> o.getLocation().getSpan().getFirstSpan())
            .thenComparingInt(o -> o.getLocation().getSpan().getStartOffset());

    /**
     * @param occurrences result of scanning this very document instance
     * @param values      replacement text for every expression in {@code occurrences}
     * @throws IllegalArgumentException if a value is missing; the document is not touched
     */
    public void substitute(TextDocument document, List<TokenOccurrence> occurrences,
                           Map<TokenExpression, String> values) {
        for (TokenOccurrence occurrence : occurrences) {
            if (values.get(occurrence.getExpression()) == null) {
                throw new IllegalArgumentException("No value for token " + occurrence.getExpression());
            }
        }

        Map<Integer, List<TokenOccurrence>> byContainer = new TreeMap<>();
        for (TokenOccurrence occurrence : occurrences) {
            byContainer.computeIfAbsent(occurrence.getLocation().getContainerIndex(), k -> new ArrayList<>())
                    .add(occurrence);
        }

        List<TextContainer> containers = document.getContainers();
        for (Map.Entry<Integer, List<TokenOccurrence>> entry : byContainer.entrySet()) {
            TextContainer container = containers.get(entry.getKey());
            List<TokenOccurrence> pending = entry.getValue();
            pending.sort(BY_POSITION.reversed());
            for (TokenOccurrence occurrence : pending) {
                replace(container, occurrence.getLocation().getSpan(), values.get(occurrence.getExpression()));
            }
        }
        log.debug("Substituted {} tokens in {} containers", occurrences.size(), byContainer.size());
    }

    private void replace(TextContainer container, TokenSpan span, String value) {
        int first = span.getFirstSpan();
        int last = span.getLastSpan();
        String firstText = container.spanText(first);

        if (span.isSingleSpan()) {
            container.setSpanText(first, firstText.substring(0, span.getStartOffset())
                    + value + firstText.substring(span.getEndOffset()));
            return;
        }

        container.setSpanText(first, firstText.substring(0, span.getStartOffset()) + value);
        for (int i = first + 1; i < last; i++) {
            clear(container, i);
        }
        String suffix = container.spanText(last).substring(span.getEndOffset());
        if (suffix.isEmpty()) {
            clear(container, last);
        } else {
            container.setSpanText(last, suffix);
        }
    }

    private void clear(TextContainer container, int index) {
        container.setSpanText(index, "");
        if (!container.removeSpan(index)) {
            log.trace("Kept structural span {} of {} as empty text", index, container.getRegion());
        }
    }
}
