package com.example.officepdf.mapper;

import com.example.officepdf.expression.TokenExpression;
import com.example.officepdf.expression.TokenParser;
import com.example.officepdf.filter.FilterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueResolverTest {

    private ValueResolver resolver;

    @BeforeEach
    public void setup() {
        resolver = new ValueResolver(FilterRegistry.withDefaults());
    }

    @Test
    public void testEndToEndScenario() {
        RowValues row = RowValues.of(Map.of("Name", "  ana  ", "Amount", "1234.5"));

        assertEquals("ANA", resolve("{{Name|trim|upper}}", row, false).getValue());
        assertEquals("1,234.50", resolve("{{Amount|currency}}", row, false).getValue());
        assertEquals("N/A", resolve("{{Missing?:N/A}}", row, false).getValue());
    }

    @Test
    public void testDefaultForAbsentField() {
        ResolvedValue value = resolve("{{Missing?:N/A}}", RowValues.of(Map.of()), false);
        assertEquals("N/A", value.getValue());
        assertFalse(value.isFieldPresent());
        assertTrue(value.isDefaultUsed());
    }

    @Test
    public void testDefaultForBlankField() {
        ResolvedValue value = resolve("{{Note?:none}}", RowValues.of(Map.of("Note", "   ")), false);
        assertEquals("none", value.getValue());
        assertTrue(value.isFieldPresent());
        assertTrue(value.isDefaultUsed());
    }

    @Test
    public void testFiltersRunAfterDefault() {
        assertEquals("N/A", resolve("{{Missing|upper?:n/a}}", RowValues.of(Map.of()), false).getValue());
        assertEquals("0.00", resolve("{{Amount|currency?:0}}", RowValues.of(Map.of()), false).getValue());
    }

    @Test
    public void testAbsentFieldWithoutDefaultIsEmptyWhenLenient() {
        ResolvedValue value = resolve("{{Missing|upper}}", RowValues.of(Map.of()), false);
        assertEquals("", value.getValue());
        assertFalse(value.isFieldPresent());
        assertFalse(value.isDefaultUsed());
    }

    @Test
    public void testStrictModeFailsOnAbsentField() {
        ResolveException e = assertThrows(ResolveException.class,
                () -> resolve("{{Missing}}", RowValues.of(Map.of("Other", "x")), true));
        assertEquals(ResolveException.Kind.MISSING_REQUIRED_FIELD, e.getKind());
        assertEquals("Missing", e.getField());
    }

    @Test
    public void testStrictModeAcceptsDefaultAndEmptyValue() {
        assertEquals("d", resolve("{{Missing?:d}}", RowValues.of(Map.of()), true).getValue());
        assertEquals("", resolve("{{Empty}}", RowValues.of(Map.of("Empty", "")), true).getValue());
    }

    @Test
    public void testCaseInsensitiveLookup() {
        RowValues row = RowValues.of(Map.of("NAME", "Ana"), true);
        assertEquals("Ana", resolve("{{name}}", row, true).getValue());
    }

    @Test
    public void testExactColumnWinsOverCaseFoldedOne() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("NAME", "upper");
        values.put("Name", "exact");
        RowValues row = RowValues.of(values, true);
        assertEquals("exact", resolve("{{Name}}", row, false).getValue());
        assertEquals("upper", resolve("{{name}}", row, false).getValue());
    }

    @Test
    public void testCaseSensitiveLookup() {
        RowValues row = RowValues.of(Map.of("NAME", "Ana"), false);
        assertFalse(resolve("{{name}}", row, false).isFieldPresent());
    }

    @Test
    public void testFilterWarningsAreCollected() {
        ResolvedValue value = resolve("{{Amount|currency|shout}}", RowValues.of(Map.of("Amount", "abc")), false);
        assertEquals("abc", value.getValue());
        List<String> warnings = value.getWarnings();
        assertEquals(2, warnings.size());
        assertTrue(warnings.get(0).contains("is not a number"));
        assertTrue(warnings.get(1).contains("unknown filter 'shout'"));
    }

    private ResolvedValue resolve(String token, RowValues row, boolean strict) {
        TokenExpression expression = TokenParser.parse(token);
        return resolver.resolve(expression, row, strict);
    }
}
