package com.example.officepdf.service;

import com.example.officepdf.document.DocumentFormat;
import com.example.officepdf.exception.TemplateProcessingException;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Maps the TEMPLATE cell of a row to a file in the template directory. Only bare
 * file names are accepted.
 */
@Component
public class TemplateResolver {

    /**
     * Name a row refers to: its own cell, or the default template when the cell is blank.
     *
     * @return the trimmed name, empty when neither is set
     */
    public String effectiveName(String cellValue, String defaultTemplate) {
        String name = cellValue == null ? "" : cellValue.strip();
        if (name.isEmpty() && defaultTemplate != null) {
            name = defaultTemplate.strip();
        }
        return name;
    }

    public Path resolve(Path templateDir, String name) {
        if (name == null || name.isBlank()) {
            throw new TemplateProcessingException("TEMPLATE_NAME_EMPTY",
                    "TEMPLATE is empty and no default template is configured");
        }
        if (name.contains("/") || name.contains("\\")) {
            throw new TemplateProcessingException("INVALID_TEMPLATE_NAME",
                    "TEMPLATE must be a file name only (no directories): '" + name + "'");
        }
        if (!DocumentFormat.isSupported(name)) {
            throw new TemplateProcessingException("UNSUPPORTED_TEMPLATE_FORMAT",
                    "Unsupported template extension: '" + name + "'");
        }
        Path path = templateDir.resolve(name);
        if (!Files.isRegularFile(path)) {
            throw new TemplateProcessingException("TEMPLATE_NOT_FOUND", "Template file not found: " + path);
        }
        return path;
    }
}
