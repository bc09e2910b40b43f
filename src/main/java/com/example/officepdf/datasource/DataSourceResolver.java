package com.example.officepdf.datasource;

import com.example.officepdf.aspect.LogExecutionTime;
import com.example.officepdf.exception.TemplateProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Picks the {@link TabularDataSource} for a data file by its extension.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataSourceResolver {
    private final List<TabularDataSource> dataSources;

    @LogExecutionTime("Data Loading")
    public DataTable load(Path file, String sheet) {
        if (!Files.isRegularFile(file)) {
            throw new TemplateProcessingException("DATA_SOURCE_UNREADABLE", "Data file not found: " + file);
        }
        TabularDataSource source = dataSources.stream()
                .filter(s -> s.supports(file))
                .findFirst()
                .orElseThrow(() -> new TemplateProcessingException("UNSUPPORTED_DATA_SOURCE",
                        "Unsupported data file (expected .xlsx, .xls or .csv): " + file.getFileName()));
        try {
            return source.read(file, sheet);
        } catch (IOException | RuntimeException e) {
            if (e instanceof TemplateProcessingException) {
                throw (TemplateProcessingException) e;
            }
            log.error("Failed to read data file {}", file, e);
            throw new TemplateProcessingException("DATA_SOURCE_UNREADABLE",
                    "Cannot read " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
