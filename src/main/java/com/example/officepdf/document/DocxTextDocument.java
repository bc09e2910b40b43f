package com.example.officepdf.document;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.apache.xmlbeans.XmlCursor;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Word-processing adapter over POI XWPF. One container per paragraph; spans are
 * the text elements of the paragraph's runs (hyperlink and field runs included).
 * Tabs and breaks inside a run are spans of their own that read as {@code \t} and
 * {@code \n} and are never edited, so a break also ends a token.
 *
 * Traversal: body elements in document order (table cells row-major, nested
 * tables recursively), then every header part, then every footer part.
 */
@Slf4j
public class DocxTextDocument implements TextDocument {
    private final XWPFDocument document;
    private final List<TextContainer> containers;

    public DocxTextDocument(XWPFDocument document, boolean includeHeadersFooters) {
        this.document = document;
        List<TextContainer> collected = new ArrayList<>();
        collectBody(document.getBodyElements(), "body", collected);
        if (includeHeadersFooters) {
            List<XWPFHeader> headers = document.getHeaderList();
            for (int i = 0; i < headers.size(); i++) {
                collectBody(headers.get(i).getBodyElements(), "header[" + (i + 1) + "]", collected);
            }
            List<XWPFFooter> footers = document.getFooterList();
            for (int i = 0; i < footers.size(); i++) {
                collectBody(footers.get(i).getBodyElements(), "footer[" + (i + 1) + "]", collected);
            }
        }
        this.containers = Collections.unmodifiableList(collected);
    }

    public static DocxTextDocument open(InputStream in, boolean includeHeadersFooters) throws IOException {
        return new DocxTextDocument(new XWPFDocument(in), includeHeadersFooters);
    }

    private static void collectBody(List<IBodyElement> elements, String region, List<TextContainer> out) {
        for (IBodyElement element : elements) {
            if (element instanceof XWPFParagraph) {
                out.add(new ParagraphContainer(region, (XWPFParagraph) element));
            } else if (element instanceof XWPFTable) {
                collectTable((XWPFTable) element, region, out);
            }
        }
    }

    private static void collectTable(XWPFTable table, String region, List<TextContainer> out) {
        for (XWPFTableRow row : table.getRows()) {
            for (XWPFTableCell cell : row.getTableCells()) {
                collectBody(cell.getBodyElements(), region, out);
            }
        }
    }

    @Override
    public DocumentFormat getFormat() {
        return DocumentFormat.DOCX;
    }

    @Override
    public List<TextContainer> getContainers() {
        return containers;
    }

    @Override
    public void write(OutputStream out) throws IOException {
        document.write(out);
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    static final class ParagraphContainer extends AbstractTextContainer<RunPart> {
        private final XWPFParagraph paragraph;

        ParagraphContainer(String region, XWPFParagraph paragraph) {
            super(region, parts(paragraph));
            this.paragraph = paragraph;
        }

        // One part per w:t, w:tab, w:br and w:cr, in document order.
        private static List<RunPart> parts(XWPFParagraph paragraph) {
            List<RunPart> parts = new ArrayList<>();
            for (XWPFRun run : paragraph.getRuns()) {
                int textIndex = 0;
                XmlCursor cursor = run.getCTR().newCursor();
                try {
                    if (cursor.toFirstChild()) {
                        do {
                            String name = cursor.getName().getLocalPart();
                            if ("t".equals(name)) {
                                parts.add(new RunPart(run, textIndex++, null));
                            } else if ("tab".equals(name)) {
                                parts.add(new RunPart(run, -1, "\t"));
                            } else if ("br".equals(name) || "cr".equals(name)) {
                                parts.add(new RunPart(run, -1, "\n"));
                            }
                        } while (cursor.toNextSibling());
                    }
                } finally {
                    cursor.dispose();
                }
            }
            return parts;
        }

        @Override
        protected String read(RunPart part) {
            if (part.isStructural()) {
                return part.structure;
            }
            return part.run.getText(part.textIndex);
        }

        // Tabs and breaks are never edited; a token that swallowed one leaves it in place.
        @Override
        protected void write(RunPart part, String text) {
            if (part.isStructural()) {
                if (!text.isEmpty() && !text.equals(part.structure)) {
                    throw new IllegalStateException("Cannot write text into a tab or break of " + getRegion());
                }
                return;
            }
            part.run.setText(text, part.textIndex);
        }

        // A run is detached only when this part is its single w:t and it holds nothing else.
        @Override
        protected boolean isPlainText(RunPart part) {
            if (part.isStructural() || part.run.getClass() != XWPFRun.class) {
                return false;
            }
            XmlCursor cursor = part.run.getCTR().newCursor();
            try {
                int texts = 0;
                if (cursor.toFirstChild()) {
                    do {
                        String name = cursor.getName().getLocalPart();
                        if ("t".equals(name)) {
                            texts++;
                        } else if (!"rPr".equals(name)) {
                            return false;
                        }
                    } while (cursor.toNextSibling());
                }
                return texts == 1;
            } finally {
                cursor.dispose();
            }
        }

        @Override
        protected void detach(RunPart part) {
            int pos = paragraph.getRuns().indexOf(part.run);
            if (pos < 0 || !paragraph.removeRun(pos)) {
                log.debug("Run already detached from paragraph in {}", getRegion());
            }
        }
    }

    /**
     * A text element of a run, or a tab/break that reads as a fixed character.
     */
    static final class RunPart {
        final XWPFRun run;
        final int textIndex;
        final String structure;

        RunPart(XWPFRun run, int textIndex, String structure) {
            this.run = run;
            this.textIndex = textIndex;
            this.structure = structure;
        }

        boolean isStructural() {
            return structure != null;
        }
    }
}
