package com.example.officepdf.document;

import com.example.officepdf.config.BatchProperties;
import com.example.officepdf.exception.TemplateProcessingException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens a template package into the adapter for its format.
 */
@Component
public class TextDocumentFactory {
    private final boolean scanHeadersFooters;
    private final boolean scanMasters;

    @Autowired
    public TextDocumentFactory(BatchProperties properties) {
        this(properties.isScanHeadersFooters(), properties.isScanMasters());
    }

    public TextDocumentFactory(boolean scanHeadersFooters, boolean scanMasters) {
        this.scanHeadersFooters = scanHeadersFooters;
        this.scanMasters = scanMasters;
    }

    /**
     * @throws TemplateProcessingException {@code UNSUPPORTED_TEMPLATE_FORMAT} for anything
     *         but {@code .docx}/{@code .pptx}; legacy formats must be normalized first
     */
    public TextDocument open(Path file) throws IOException {
        DocumentFormat format = DocumentFormat.fromFileName(file.getFileName().toString())
                .orElseThrow(() -> new TemplateProcessingException("UNSUPPORTED_TEMPLATE_FORMAT",
                        "Not a DOCX or PPTX template: " + file.getFileName()));
        try (InputStream in = Files.newInputStream(file)) {
            return open(in, format);
        }
    }

    public TextDocument open(InputStream in, DocumentFormat format) throws IOException {
        switch (format) {
            case DOCX:
                return DocxTextDocument.open(in, scanHeadersFooters);
            case PPTX:
                return PptxTextDocument.open(in, scanMasters);
            default:
                throw new TemplateProcessingException("UNSUPPORTED_TEMPLATE_FORMAT", "No adapter for " + format);
        }
    }
}
