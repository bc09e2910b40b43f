package com.example.officepdf.cli;

import com.example.officepdf.exception.TemplateProcessingException;
import com.example.officepdf.model.BatchRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link BatchRequest} from a YAML (or JSON) job file:
 *
 * <pre>
 * templateDir: ./templates
 * dataPath: ./students.xlsx
 * sheet: Course A
 * outputDir: ./out
 * filenamePattern: "{index:04d}_{Name}.pdf"
 * where: "COURSE == 'A'"
 * dryRun: true
 * </pre>
 *
 * Unknown keys are rejected so typos do not silently fall back to defaults.
 */
@Slf4j
@Component
public class JobFileLoader {
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public BatchRequest load(Path jobFile) {
        if (!Files.isRegularFile(jobFile)) {
            throw new TemplateProcessingException("INVALID_REQUEST", "Job file not found: " + jobFile);
        }
        try {
            BatchRequest request = yamlMapper.readValue(jobFile.toFile(), BatchRequest.class);
            log.info("Loaded job file {}", jobFile);
            return request == null ? new BatchRequest() : request;
        } catch (IOException e) {
            throw new TemplateProcessingException("INVALID_REQUEST",
                    "Invalid job file " + jobFile + ": " + e.getMessage(), e);
        }
    }
}
