package com.example.officepdf.filter;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Re-formats a date written in one of the configured input patterns.
 * An ISO date-time ({@code 2024-03-01T10:15:00}, {@code 2024-03-01 00:00:00}) is
 * accepted as well since that is how spreadsheet date cells are stringified.
 */
public class DateFilter implements TokenFilter {
    private static final Pattern ISO_DATE_TIME =
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?");

    private final String name;
    private final List<DateTimeFormatter> inputFormats = new ArrayList<>();
    private final DateTimeFormatter outputFormat;

    public DateFilter(String name, List<String> inputPatterns, String outputPattern) {
        this.name = name;
        for (String pattern : inputPatterns) {
            inputFormats.add(DateTimeFormatter.ofPattern(strictYear(pattern)).withResolverStyle(ResolverStyle.STRICT));
        }
        this.outputFormat = DateTimeFormatter.ofPattern(outputPattern);
    }

    @Override
    public FilterOutcome apply(String value) {
        if (value == null || value.isBlank()) {
            return FilterOutcome.of("");
        }
        String candidate = value.strip();
        if (ISO_DATE_TIME.matcher(candidate).matches()) {
            candidate = candidate.substring(0, 10);
        }
        for (DateTimeFormatter format : inputFormats) {
            Optional<LocalDate> date = tryParse(candidate, format);
            if (date.isPresent()) {
                return FilterOutcome.of(date.get().format(outputFormat));
            }
        }
        return FilterOutcome.unchanged(value, name + ": '" + value + "' does not match any known date pattern");
    }

    private static Optional<LocalDate> tryParse(String text, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(text, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    // STRICT resolution needs proleptic years ('u'); 'y' is year-of-era and needs an era field.
    private static String strictYear(String pattern) {
        return pattern.indexOf('\'') >= 0 ? pattern : pattern.replace('y', 'u');
    }
}
