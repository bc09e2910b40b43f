package com.example.officepdf.filter;

import com.example.officepdf.config.FilterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FilterRegistryTest {

    private FilterRegistry registry;

    @BeforeEach
    public void setup() {
        registry = FilterRegistry.withDefaults();
    }

    @Test
    public void testTextFilters() {
        assertEquals("  ana  ", registry.apply(FilterName.IDENTITY, "  ana  ").getValue());
        assertEquals("ana", registry.apply(FilterName.TRIM, "\t ana \n").getValue());
        assertEquals("ANA ÑU", registry.apply(FilterName.UPPER, "ana ñu").getValue());
        assertEquals("istanbul", registry.apply(FilterName.LOWER, "ISTANBUL").getValue());
    }

    @Test
    public void testNormalizingFiltersAreIdempotent() {
        for (String input : List.of("", "  a b  ", "MiXeD", "ß", " x ")) {
            String upper = registry.apply("upper", input).getValue();
            assertEquals(upper, registry.apply("upper", upper).getValue());
            String trimmed = registry.apply("trim", input).getValue();
            assertEquals(trimmed, registry.apply("trim", trimmed).getValue());
        }
    }

    @Test
    public void testCurrencyFormatting() {
        assertEquals("1,234.50", registry.apply(FilterName.CURRENCY, "1234.5").getValue());
        assertEquals("1,234.50", registry.apply(FilterName.CURRENCY, "1.234,5").getValue());
        assertEquals("1,234.50", registry.apply(FilterName.CURRENCY, " 1,234.50 ").getValue());
        assertEquals("0.13", registry.apply(FilterName.CURRENCY, "0.125").getValue());
        assertEquals("-12.00", registry.apply(FilterName.CURRENCY, "-12").getValue());
        assertEquals("1,234,567.89", registry.apply(FilterName.CURRENCY, "1234567.885").getValue());
    }

    @Test
    public void testCurrencyHonoursConfiguredLocale() {
        FilterProperties properties = new FilterProperties();
        properties.setCurrencyLocale("de-DE");
        FilterRegistry german = new FilterRegistry(properties);
        assertEquals("1.234,50", german.apply(FilterName.CURRENCY, "1234.5").getValue());
    }

    @Test
    public void testEuros() {
        assertEquals("1.234,50 €", registry.apply(FilterName.EUROS, "1234.5").getValue());
        assertEquals("0,00 €", registry.apply(FilterName.EUROS, "0").getValue());
    }

    @Test
    public void testNumberFilterPassesThroughUnparseableInput() {
        FilterOutcome outcome = registry.apply(FilterName.CURRENCY, "n/a");
        assertEquals("n/a", outcome.getValue());
        assertTrue(outcome.hasWarning());
        assertTrue(outcome.getWarning().contains("is not a number"));
    }

    @Test
    public void testBlankNumberIsBlankWithoutWarning() {
        FilterOutcome outcome = registry.apply(FilterName.CURRENCY, "  ");
        assertFalse(outcome.hasWarning());
    }

    @Test
    public void testDateFilters() {
        assertEquals("01/03/2024", registry.apply(FilterName.DATE, "2024-03-01").getValue());
        assertEquals("01/03/2024", registry.apply(FilterName.DATE, "2024-03-01T10:15:00").getValue());
        assertEquals("01/03/2024", registry.apply(FilterName.DMY, "2024/03/01").getValue());
        assertEquals("01/03/2024", registry.apply(FilterName.DMY, "01-03-2024").getValue());
    }

    @Test
    public void testDateOutputPatternIsConfigurable() {
        FilterProperties properties = new FilterProperties();
        properties.setDateOutputPattern("yyyy.MM.dd");
        FilterRegistry custom = new FilterRegistry(properties);
        assertEquals("2024.03.01", custom.apply(FilterName.DATE, "01/03/2024").getValue());
        assertEquals("01/03/2024", custom.apply(FilterName.DMY, "2024-03-01").getValue());
    }

    @Test
    public void testInvalidDatePassesThrough() {
        FilterOutcome outcome = registry.apply(FilterName.DATE, "2024-02-30");
        assertEquals("2024-02-30", outcome.getValue());
        assertTrue(outcome.hasWarning());
    }

    @Test
    public void testUnknownFilterName() {
        FilterOutcome outcome = registry.apply("shout", "hi");
        assertEquals("hi", outcome.getValue());
        assertEquals("unknown filter 'shout'", outcome.getWarning());
    }

    @Test
    public void testFilterNamesAreCaseSensitive() {
        assertTrue(registry.apply("UPPER", "x").hasWarning());
    }

    @Test
    public void testRegisterReplacesEntry() {
        registry.register(FilterName.UPPER, value -> FilterOutcome.of("[" + value + "]"));
        assertEquals("[x]", registry.apply("upper", "x").getValue());
    }

    @Test
    public void testThrowingFilterIsContained() {
        registry.register(FilterName.TRIM, value -> {
            throw new IllegalStateException("boom");
        });
        FilterOutcome outcome = registry.apply(FilterName.TRIM, " x ");
        assertEquals(" x ", outcome.getValue());
        assertTrue(outcome.getWarning().contains("boom"));
    }
}
