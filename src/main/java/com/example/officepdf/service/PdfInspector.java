package com.example.officepdf.service;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Checks renderer output with PDFBox.
 */
@Component
public class PdfInspector {

    /**
     * @throws IOException when the file is not a loadable PDF
     */
    public int countPages(Path pdf) throws IOException {
        try (PDDocument document = PDDocument.load(pdf.toFile())) {
            return document.getNumberOfPages();
        }
    }
}
