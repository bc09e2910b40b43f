package com.example.officepdf.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * How to invoke LibreOffice for PDF export and legacy template conversion.
 */
@Data
@NoArgsConstructor
@Component
@ConfigurationProperties(prefix = "officepdf.libreoffice")
public class LibreOfficeProperties {

    /**
     * soffice executable; resolved from PATH when not absolute.
     */
    private String binary = "soffice";

    private String pdfFilter = "pdf";

    /**
     * Appended to the filter as "pdf:options", e.g. "writer_pdf_Export".
     */
    private String pdfFilterOptions;

    private Duration timeout = Duration.ofMinutes(2);

    /**
     * When true every conversion gets its own user profile directory so several
     * soffice processes may run at once.
     */
    private boolean reentrant = false;
}
