package com.example.officepdf.filter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Optional;

/**
 * Formats an amount with fixed two decimals (half-up) and the separators of a locale.
 */
public class CurrencyFilter implements TokenFilter {
    private final String name;
    private final String pattern;
    private final Locale locale;

    public CurrencyFilter(String name, String pattern, Locale locale) {
        this.name = name;
        this.pattern = pattern;
        this.locale = locale;
        // fail at startup rather than on the first row
        newFormat();
    }

    @Override
    public FilterOutcome apply(String value) {
        if (value == null || value.isBlank()) {
            return FilterOutcome.of(value == null ? "" : value);
        }
        Optional<BigDecimal> amount = LenientNumbers.parse(value);
        if (amount.isEmpty()) {
            return FilterOutcome.unchanged(value, name + ": '" + value + "' is not a number");
        }
        BigDecimal rounded = amount.get().setScale(2, RoundingMode.HALF_UP);
        return FilterOutcome.of(newFormat().format(rounded));
    }

    // DecimalFormat is not thread-safe
    private DecimalFormat newFormat() {
        DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(locale));
        format.setRoundingMode(RoundingMode.HALF_UP);
        format.setMinimumFractionDigits(2);
        format.setMaximumFractionDigits(2);
        return format;
    }
}
