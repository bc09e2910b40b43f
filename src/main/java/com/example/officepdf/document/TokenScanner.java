package com.example.officepdf.document;

import com.example.officepdf.expression.TokenExpression;
import com.example.officepdf.expression.TokenParseException;
import com.example.officepdf.expression.TokenParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds {@code {{...}}} tokens in every container of a document, including tokens
 * whose characters are spread over several spans.
 *
 * Per container the spans are concatenated and searched for delimiters:
 * <ul>
 *   <li>an opening <code>{{</code> followed by another one before the next <code>}}</code> is
 *       unterminated; the search restarts at the later one</li>
 *   <li>a line break between the delimiters also ends the token</li>
 *   <li>an opening <code>{{</code> with no closing delimiter left is unterminated</li>
 * </ul>
 * Bodies that fail to parse are reported as {@link TokenParseFailure}s. Scanning
 * never modifies the document.
 */
@Slf4j
@Component
public class TokenScanner {
    private static final int EXCERPT_LENGTH = 40;

    public ScanResult scan(TextDocument document) {
        List<TokenOccurrence> occurrences = new ArrayList<>();
        List<ScanWarning> warnings = new ArrayList<>();
        List<TokenParseFailure> failures = new ArrayList<>();

        List<TextContainer> containers = document.getContainers();
        for (int c = 0; c < containers.size(); c++) {
            scanContainer(c, containers.get(c), occurrences, warnings, failures);
        }

        log.debug("Scanned {} containers: {} tokens, {} warnings, {} parse failures",
                containers.size(), occurrences.size(), warnings.size(), failures.size());
        return new ScanResult(Collections.unmodifiableList(occurrences),
                Collections.unmodifiableList(warnings),
                Collections.unmodifiableList(failures));
    }

    private void scanContainer(int index, TextContainer container, List<TokenOccurrence> occurrences,
                               List<ScanWarning> warnings, List<TokenParseFailure> failures) {
        int spans = container.spanCount();
        int[] starts = new int[spans + 1];
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < spans; i++) {
            starts[i] = sb.length();
            sb.append(container.spanText(i));
        }
        starts[spans] = sb.length();
        String text = sb.toString();
        String region = container.getRegion();

        int pos = 0;
        while (true) {
            int open = text.indexOf(TokenExpression.OPEN, pos);
            if (open < 0) {
                return;
            }
            int close = text.indexOf(TokenExpression.CLOSE, open + 2);
            int limit = close < 0 ? text.length() : close;

            int newline = text.indexOf('\n', open + 2);
            if (newline >= 0 && newline < limit) {
                warnings.add(unterminated(index, region, text, open));
                pos = newline + 1;
                continue;
            }
            int nextOpen = text.indexOf(TokenExpression.OPEN, open + 2);
            if (nextOpen >= 0 && nextOpen < limit) {
                warnings.add(unterminated(index, region, text, open));
                pos = nextOpen;
                continue;
            }
            if (close < 0) {
                warnings.add(unterminated(index, region, text, open));
                return;
            }

            int end = close + 2;
            String raw = text.substring(open, end);
            try {
                TokenExpression expression = TokenParser.parse(raw);
                TokenSpan span = locate(starts, spans, open, end);
                occurrences.add(new TokenOccurrence(expression, new TokenLocation(index, region, span), raw));
            } catch (TokenParseException e) {
                failures.add(new TokenParseFailure(raw, e.getKind(), e.getMessage(), index, region));
            }
            pos = end;
        }
    }

    // Maps [start, end) in the concatenated text to span coordinates; empty spans
    // never hold the first or last character.
    static TokenSpan locate(int[] starts, int spans, int start, int end) {
        int first = -1;
        int last = -1;
        for (int i = 0; i < spans; i++) {
            int from = starts[i];
            int to = starts[i + 1];
            if (from == to) {
                continue;
            }
            if (first < 0 && start >= from && start < to) {
                first = i;
            }
            if (end > from && end <= to) {
                last = i;
                break;
            }
        }
        if (first < 0 || last < 0) {
            throw new IllegalStateException("Token range [" + start + ", " + end + ") outside container text");
        }
        return new TokenSpan(first, start - starts[first], last, end - starts[last]);
    }

    private static ScanWarning unterminated(int index, String region, String text, int open) {
        int to = Math.min(text.length(), open + EXCERPT_LENGTH);
        int newline = text.indexOf('\n', open);
        if (newline >= 0 && newline < to) {
            to = newline;
        }
        return new ScanWarning(ScanWarning.Kind.UNTERMINATED_TOKEN, index, region, text.substring(open, to));
    }
}
