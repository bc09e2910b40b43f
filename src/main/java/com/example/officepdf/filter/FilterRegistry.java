package com.example.officepdf.filter;

import com.example.officepdf.config.FilterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each {@link FilterName} to its implementation. Built once at startup from
 * {@link FilterProperties}; entries may be replaced with {@link #register}.
 *
 * Applying a filter never throws: unknown names, unparseable input and
 * unexpected runtime failures all come back as the unchanged value plus a warning.
 */
@Slf4j
@Component
public class FilterRegistry {
    private static final String DMY_PATTERN = "dd/MM/yyyy";

    private final Map<FilterName, TokenFilter> filters = new EnumMap<>(FilterName.class);

    @Autowired
    public FilterRegistry(FilterProperties properties) {
        Locale currencyLocale = Locale.forLanguageTag(properties.getCurrencyLocale());
        List<String> datePatterns = properties.getDateInputPatterns();

        register(FilterName.IDENTITY, FilterOutcome::of);
        register(FilterName.TRIM, value -> FilterOutcome.of(value.strip()));
        register(FilterName.UPPER, value -> FilterOutcome.of(value.toUpperCase(Locale.ROOT)));
        register(FilterName.LOWER, value -> FilterOutcome.of(value.toLowerCase(Locale.ROOT)));
        register(FilterName.CURRENCY, new CurrencyFilter("currency", properties.getCurrencyPattern(), currencyLocale));
        register(FilterName.EUROS, new CurrencyFilter("euros", "#,##0.00 €", Locale.GERMANY));
        register(FilterName.DATE, new DateFilter("date", datePatterns, properties.getDateOutputPattern()));
        register(FilterName.DMY, new DateFilter("dmy", datePatterns, DMY_PATTERN));

        log.debug("Registered token filters: {}", filters.keySet());
    }

    /**
     * Registry with the default {@link FilterProperties}.
     */
    public static FilterRegistry withDefaults() {
        return new FilterRegistry(new FilterProperties());
    }

    public void register(FilterName name, TokenFilter filter) {
        filters.put(name, filter);
    }

    public FilterOutcome apply(FilterName name, String value) {
        String input = value == null ? "" : value;
        TokenFilter filter = filters.get(name);
        if (filter == null) {
            return FilterOutcome.unchanged(input, "no implementation registered for filter '" + name.getToken() + "'");
        }
        try {
            return filter.apply(input);
        } catch (RuntimeException e) {
            log.warn("Filter '{}' failed on value '{}'", name.getToken(), input, e);
            return FilterOutcome.unchanged(input, name.getToken() + ": " + e.getMessage());
        }
    }

    /**
     * Late-bound application by the name written in the template.
     */
    public FilterOutcome apply(String filterName, String value) {
        Optional<FilterName> name = FilterName.fromToken(filterName);
        if (name.isEmpty()) {
            return FilterOutcome.unchanged(value == null ? "" : value, "unknown filter '" + filterName + "'");
        }
        return apply(name.get(), value);
    }
}
