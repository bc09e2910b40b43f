package com.example.officepdf.renderer;

import com.example.officepdf.document.DocumentFormat;
import com.example.officepdf.exception.RendererException;

import java.nio.file.Path;

/**
 * External converter from a filled template to PDF. Failures are opaque to the
 * caller and reported with their message only.
 */
public interface PdfRenderer {

    String getName();

    boolean supports(RendererType type, DocumentFormat format);

    /**
     * Whether several {@link #render} calls may run at the same time. Non-reentrant
     * renderers are called behind a {@link RendererGate}.
     */
    boolean isReentrant();

    /**
     * @param document  filled DOCX/PPTX file
     * @param outputDir directory the PDF is written to
     * @return the produced PDF
     */
    Path render(Path document, Path outputDir) throws RendererException;
}
