package com.example.officepdf.document;

import com.example.officepdf.expression.TokenParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenScannerTest {

    private final TokenScanner scanner = new TokenScanner();

    @Test
    public void testSingleSpanToken() {
        ScanResult result = scanner.scan(new InMemoryTextDocument().container("Hello {{Name}}!"));

        assertEquals(1, result.getOccurrences().size());
        TokenOccurrence occurrence = result.getOccurrences().get(0);
        assertEquals("Name", occurrence.getExpression().getFieldName());
        assertEquals("{{Name}}", occurrence.getRaw());
        assertEquals(new TokenSpan(0, 6, 0, 14), occurrence.getLocation().getSpan());
    }

    @Test
    public void testTokenAcrossSpans() {
        ScanResult result = scanner.scan(new InMemoryTextDocument().container("A {{X", "}} B"));

        assertEquals(1, result.getOccurrences().size());
        TokenOccurrence occurrence = result.getOccurrences().get(0);
        assertEquals("X", occurrence.getExpression().getFieldName());
        assertEquals(new TokenSpan(0, 2, 1, 2), occurrence.getLocation().getSpan());
    }

    @Test
    public void testDelimitersSplitCharacterByCharacter() {
        ScanResult result = scanner.scan(new InMemoryTextDocument()
                .container("x{", "{", "Na", "", "me|up", "per}", "}y"));

        assertEquals(1, result.getOccurrences().size());
        TokenOccurrence occurrence = result.getOccurrences().get(0);
        assertEquals("{{Name|upper}}", occurrence.getExpression().serialize());
        assertEquals(new TokenSpan(0, 1, 6, 1), occurrence.getLocation().getSpan());
    }

    @Test
    public void testSeveralTokensInOneContainerAndAcrossContainers() {
        ScanResult result = scanner.scan(new InMemoryTextDocument()
                .container("{{A}} and {{B}}")
                .container("none")
                .container("{{A}}"));

        List<TokenOccurrence> occurrences = result.getOccurrences();
        assertEquals(3, occurrences.size());
        assertEquals(0, occurrences.get(0).getLocation().getContainerIndex());
        assertEquals(0, occurrences.get(1).getLocation().getContainerIndex());
        assertEquals(2, occurrences.get(2).getLocation().getContainerIndex());
        assertEquals(2, result.expressions().size());
    }

    @Test
    public void testUnterminatedTokenAtEnd() {
        ScanResult result = scanner.scan(new InMemoryTextDocument().container("Hello {{Name"));

        assertTrue(result.getOccurrences().isEmpty());
        assertEquals(1, result.getWarnings().size());
        assertEquals(ScanWarning.Kind.UNTERMINATED_TOKEN, result.getWarnings().get(0).getKind());
        assertEquals("{{Name", result.getWarnings().get(0).getExcerpt());
    }

    @Test
    public void testEarlierOpeningIsUnterminatedWhenAnotherOpensFirst() {
        ScanResult result = scanner.scan(new InMemoryTextDocument().container("{{A {{B}} C"));

        assertEquals(1, result.getWarnings().size());
        assertEquals(1, result.getOccurrences().size());
        assertEquals("B", result.getOccurrences().get(0).getExpression().getFieldName());
        assertEquals(new TokenSpan(0, 4, 0, 9), result.getOccurrences().get(0).getLocation().getSpan());
    }

    @Test
    public void testLineBreakEndsToken() {
        ScanResult result = scanner.scan(new InMemoryTextDocument().container("{{A", "\n", "B}} {{C}}"));

        assertEquals(1, result.getWarnings().size());
        assertEquals(1, result.getOccurrences().size());
        assertEquals("C", result.getOccurrences().get(0).getExpression().getFieldName());
    }

    @Test
    public void testTokenNeverSpansContainers() {
        ScanResult result = scanner.scan(new InMemoryTextDocument().container("{{A").container("}}"));

        assertTrue(result.getOccurrences().isEmpty());
        assertEquals(1, result.getWarnings().size());
    }

    @Test
    public void testParseFailuresAreCollected() {
        ScanResult result = scanner.scan(new InMemoryTextDocument().container("{{A||upper}} {{B}} {{C?x}}"));

        assertEquals(1, result.getOccurrences().size());
        assertTrue(result.hasParseFailures());
        assertEquals(2, result.getParseFailures().size());
        assertEquals(TokenParseException.Kind.EMPTY_FILTER, result.getParseFailures().get(0).getKind());
        assertEquals(TokenParseException.Kind.MALFORMED_DEFAULT, result.getParseFailures().get(1).getKind());
        assertEquals("{{C?x}}", result.getParseFailures().get(1).getRaw());
    }

    @Test
    public void testScanDoesNotModifyDocument() {
        InMemoryTextDocument document = new InMemoryTextDocument().container("A {{X", "}} B");
        scanner.scan(document);
        scanner.scan(document);

        assertEquals("A {{X}} B", document.get(0).text());
        assertEquals(2, document.get(0).spanCount());
        assertEquals(0, document.get(0).detachedCount());
    }

    @Test
    public void testLocateSkipsEmptySpans() {
        int[] starts = {0, 2, 2, 5};
        TokenSpan span = TokenScanner.locate(starts, 3, 2, 5);
        assertEquals(new TokenSpan(2, 0, 2, 3), span);
    }
}
