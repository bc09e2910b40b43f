package com.example.officepdf.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the locale- and pattern-dependent token filters.
 */
@Data
@NoArgsConstructor
@Component
@ConfigurationProperties(prefix = "officepdf.filters")
public class FilterProperties {

    /**
     * BCP 47 tag whose grouping/decimal separators the {@code currency} filter uses.
     */
    private String currencyLocale = "en-US";

    /**
     * {@link java.text.DecimalFormat} pattern of the {@code currency} filter.
     */
    private String currencyPattern = "#,##0.00";

    /**
     * Patterns tried in order by the {@code date} and {@code dmy} filters.
     */
    private List<String> dateInputPatterns = new ArrayList<>(List.of(
            "yyyy-MM-dd", "dd/MM/yyyy", "dd-MM-yyyy", "yyyy/MM/dd"));

    private String dateOutputPattern = "dd/MM/yyyy";
}
