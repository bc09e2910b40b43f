package com.example.officepdf.service;

import com.example.officepdf.aspect.LogExecutionTime;
import com.example.officepdf.document.ScanResult;
import com.example.officepdf.document.ScanWarning;
import com.example.officepdf.document.TextDocument;
import com.example.officepdf.document.TextDocumentFactory;
import com.example.officepdf.document.TokenScanner;
import com.example.officepdf.document.TokenSubstitutionEngine;
import com.example.officepdf.exception.TemplateProcessingException;
import com.example.officepdf.expression.TokenExpression;
import com.example.officepdf.mapper.ResolvedValue;
import com.example.officepdf.mapper.RowValues;
import com.example.officepdf.mapper.ValueResolver;
import com.example.officepdf.model.TemplateScan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the filled document of one row. Each call opens its own copy of the
 * template, so rows never share a document tree.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentFiller {
    private final TextDocumentFactory documentFactory;
    private final TokenScanner scanner;
    private final ValueResolver valueResolver;
    private final TokenSubstitutionEngine substitutionEngine;

    /**
     * Resolve every token of the template against the row without touching any file.
     *
     * @throws com.example.officepdf.mapper.ResolveException strict mode, missing field
     */
    public FillOutcome resolve(TemplateScan template, RowValues row, boolean strict) {
        requireParseable(template);
        return resolveAll(template.getExpressions(), row, strict);
    }

    /**
     * Resolve, substitute and write the filled document to {@code target}. All values
     * are resolved before the document is modified; on failure nothing is written.
     */
    @LogExecutionTime("Document Fill")
    public FillOutcome fill(TemplateScan template, RowValues row, boolean strict, Path target) throws IOException {
        requireParseable(template);
        try (TextDocument document = documentFactory.open(template.getDocumentPath())) {
            ScanResult scan = scanner.scan(document);
            List<TokenExpression> expressions = new ArrayList<>(scan.expressions());
            FillOutcome outcome = resolveAll(expressions, row, strict);

            substitutionEngine.substitute(document, scan.getOccurrences(), outcome.getValues());

            List<String> warnings = new ArrayList<>(outcome.getWarnings());
            for (ScanWarning warning : scan.getWarnings()) {
                warnings.add(warning.getMessage());
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                document.write(out);
            }
            log.debug("Filled {} tokens of {} into {}", expressions.size(), template.getTemplateName(), target);
            return new FillOutcome(outcome.getValues(), warnings);
        }
    }

    private FillOutcome resolveAll(Collection<TokenExpression> expressions, RowValues row, boolean strict) {
        Map<TokenExpression, String> values = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        for (TokenExpression expression : expressions) {
            ResolvedValue resolved = valueResolver.resolve(expression, row, strict);
            values.put(expression, resolved.getValue());
            for (String warning : resolved.getWarnings()) {
                log.warn("{}", warning);
                warnings.add(warning);
            }
        }
        return new FillOutcome(values, warnings);
    }

    private static void requireParseable(TemplateScan template) {
        if (template.hasParseFailures()) {
            throw new TemplateProcessingException("TOKEN_PARSE_ERROR",
                    "Template " + template.getTemplateName() + " has malformed tokens: "
                            + String.join("; ", template.getParseFailures()));
        }
    }
}
