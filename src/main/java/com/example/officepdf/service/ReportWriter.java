package com.example.officepdf.service;

import com.example.officepdf.model.RowReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the per-row status records as a pretty-printed JSON array and as CSV.
 * A report that cannot be written is logged and does not fail the batch.
 */
@Slf4j
@Component
public class ReportWriter {
    static final String WARNING_SEPARATOR = " | ";

    private static final CsvSchema CSV_SCHEMA = CsvSchema.builder()
            .addColumn("row")
            .addColumn("status")
            .addColumn("template")
            .addColumn("output")
            .addColumn("bytes")
            .addColumn("pages")
            .addColumn("error")
            .addColumn("warnings")
            .build()
            .withHeader();

    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final CsvMapper csvMapper = new CsvMapper();

    public boolean writeJson(Path file, List<RowReport> rows) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            jsonMapper.writeValue(file.toFile(), rows);
            log.info("Report saved to: {}", file);
            return true;
        } catch (IOException e) {
            log.warn("Could not write JSON report {}: {}", file, e.getMessage());
            return false;
        }
    }

    public boolean writeCsv(Path file, List<RowReport> rows) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (RowReport row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("row", row.getRowIndex());
            record.put("status", row.getStatus() == null ? "" : row.getStatus().getLabel());
            record.put("template", nullToEmpty(row.getTemplateName()));
            record.put("output", nullToEmpty(row.getOutputPath()));
            record.put("bytes", row.getBytes() == null ? "" : row.getBytes());
            record.put("pages", row.getPages() == null ? "" : row.getPages());
            record.put("error", nullToEmpty(row.getError()));
            record.put("warnings", row.getWarnings() == null ? "" : String.join(WARNING_SEPARATOR, row.getWarnings()));
            records.add(record);
        }
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            csvMapper.writer(CSV_SCHEMA).writeValue(file.toFile(), records);
            log.info("Report saved to: {}", file);
            return true;
        } catch (IOException e) {
            log.warn("Could not write CSV report {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
