package com.example.officepdf.renderer;

import com.example.officepdf.aspect.LogExecutionTime;
import com.example.officepdf.config.LibreOfficeProperties;
import com.example.officepdf.document.DocumentFormat;
import com.example.officepdf.exception.RendererException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * PDF export through a headless LibreOffice process. Handles both template formats.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LibreOfficePdfRenderer implements PdfRenderer {
    private final LibreOfficeCommand command;
    private final LibreOfficeProperties properties;

    @Override
    public String getName() {
        return "libreoffice";
    }

    @Override
    public boolean supports(RendererType type, DocumentFormat format) {
        return type == RendererType.AUTO || type == RendererType.LIBREOFFICE;
    }

    @Override
    public boolean isReentrant() {
        return properties.isReentrant();
    }

    @Override
    @LogExecutionTime("LibreOffice PDF Export")
    public Path render(Path document, Path outputDir) throws RendererException {
        String options = properties.getPdfFilterOptions();
        String target = options == null || options.isBlank()
                ? properties.getPdfFilter()
                : properties.getPdfFilter() + ":" + options;
        command.convert(document, outputDir, target);

        String fileName = document.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        Path produced = outputDir.resolve((dot < 0 ? fileName : fileName.substring(0, dot)) + ".pdf");
        if (!Files.isRegularFile(produced)) {
            throw new RendererException("No PDF produced by LibreOffice for " + fileName);
        }
        log.debug("LibreOffice produced {}", produced);
        return produced;
    }
}
