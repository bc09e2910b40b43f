package com.example.officepdf.config;

import com.example.officepdf.renderer.RendererType;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Batch defaults. Every value can be overridden per run through a
 * {@link com.example.officepdf.model.BatchRequest}.
 *
 * Example application.yml:
 *
 * officepdf:
 *   batch:
 *     template-dir: ./templates
 *     data-path: ./data.xlsx
 *     output-dir: ./output
 *     filename-pattern: "{NAME} - {OUTPUT}.pdf"
 *     strict: false
 *     renderer: AUTO
 *     row-timeout: 5m
 *     parallelism: 1
 */
@Data
@NoArgsConstructor
@Component
@ConfigurationProperties(prefix = "officepdf.batch")
public class BatchProperties {

    /**
     * Directory holding template files; the TEMPLATE column names a file in it.
     */
    private String templateDir = "templates";

    /**
     * Input spreadsheet (xlsx/xls) or CSV file.
     */
    private String dataPath = "data.xlsx";

    /**
     * Directory receiving PDFs and the batch reports.
     */
    private String outputDir = "output";

    /**
     * Sheet name or zero-based index; ignored for CSV.
     */
    private String sheet = "0";

    /**
     * Output file name pattern. Placeholders: {Column}, {index}, {index:04d}.
     */
    private String filenamePattern = "{index:04d}.pdf";

    /**
     * Template used when a row's TEMPLATE cell is empty; null means such rows fail.
     */
    private String defaultTemplate;

    private boolean dryRun = false;

    /**
     * Fail a row when a token without default references a column absent from the row.
     */
    private boolean strict = false;

    /**
     * Abort the batch before processing any row when preflight finds missing columns.
     */
    private boolean failOnMissingColumns = false;

    /**
     * Additional export attempts after a failed render (total tries = retries + 1).
     */
    private int exportRetries = 2;

    private RendererType renderer = RendererType.AUTO;

    private Duration rowTimeout = Duration.ofMinutes(5);

    /**
     * Rows processed concurrently. Renderer calls stay serialized unless the
     * renderer declares itself reentrant.
     */
    private int parallelism = 1;

    private boolean scanHeadersFooters = true;

    private boolean scanMasters = true;

    /**
     * Match token field names against column names ignoring case.
     */
    private boolean caseInsensitiveColumns = true;

    private String templateColumn = "TEMPLATE";

    private String skipColumn = "SKIP";

    private String outputColumn = "OUTPUT";

    private String jsonReportName = "_report.json";

    private String csvReportName = "_report.csv";
}
