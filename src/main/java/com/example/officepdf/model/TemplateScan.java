package com.example.officepdf.model;

import com.example.officepdf.document.DocumentFormat;
import com.example.officepdf.expression.TokenExpression;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Document-independent summary of a template scan; safe to share between rows.
 */
@Value
public class TemplateScan {
    String templateName;
    /**
     * The DOCX/PPTX file that is opened for each row (the converted copy for legacy templates).
     */
    Path documentPath;
    DocumentFormat format;
    Set<TokenExpression> expressions;
    List<String> warnings;
    List<String> parseFailures;

    public boolean hasParseFailures() {
        return !parseFailures.isEmpty();
    }
}
