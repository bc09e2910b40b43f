package com.example.officepdf.document;

import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFSlideLayout;
import org.apache.poi.xslf.usermodel.XSLFSlideMaster;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.openxmlformats.schemas.drawingml.x2006.main.CTRegularTextRun;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Presentation adapter over POI XSLF. One container per text paragraph; spans are
 * the paragraph's text runs. Line breaks read as {@code "\n"} and are never edited.
 *
 * Traversal: for each slide its shapes in z-order (tables row-major, groups
 * recursively) then its notes; afterwards every master followed by its layouts.
 */
public class PptxTextDocument implements TextDocument {
    private final XMLSlideShow slideShow;
    private final List<TextContainer> containers;

    public PptxTextDocument(XMLSlideShow slideShow, boolean includeMasters) {
        this.slideShow = slideShow;
        List<TextContainer> collected = new ArrayList<>();
        List<XSLFSlide> slides = slideShow.getSlides();
        for (int i = 0; i < slides.size(); i++) {
            XSLFSlide slide = slides.get(i);
            collectShapes(slide.getShapes(), "slide[" + (i + 1) + "]", collected);
            XSLFNotes notes = slide.getNotes();
            if (notes != null) {
                collectShapes(notes.getShapes(), "notes[" + (i + 1) + "]", collected);
            }
        }
        if (includeMasters) {
            List<XSLFSlideMaster> masters = slideShow.getSlideMasters();
            for (int m = 0; m < masters.size(); m++) {
                XSLFSlideMaster master = masters.get(m);
                collectShapes(master.getShapes(), "master[" + (m + 1) + "]", collected);
                XSLFSlideLayout[] layouts = master.getSlideLayouts();
                for (int l = 0; l < layouts.length; l++) {
                    collectShapes(layouts[l].getShapes(), "layout[" + (m + 1) + "." + (l + 1) + "]", collected);
                }
            }
        }
        this.containers = Collections.unmodifiableList(collected);
    }

    public static PptxTextDocument open(InputStream in, boolean includeMasters) throws IOException {
        return new PptxTextDocument(new XMLSlideShow(in), includeMasters);
    }

    private static void collectShapes(List<XSLFShape> shapes, String region, List<TextContainer> out) {
        for (XSLFShape shape : shapes) {
            if (shape instanceof XSLFTable) {
                for (XSLFTableRow row : ((XSLFTable) shape).getRows()) {
                    for (XSLFTableCell cell : row.getCells()) {
                        collectParagraphs(cell, region, out);
                    }
                }
            } else if (shape instanceof XSLFTextShape) {
                collectParagraphs((XSLFTextShape) shape, region, out);
            } else if (shape instanceof XSLFGroupShape) {
                collectShapes(((XSLFGroupShape) shape).getShapes(), region, out);
            }
        }
    }

    private static void collectParagraphs(XSLFTextShape shape, String region, List<TextContainer> out) {
        for (XSLFTextParagraph paragraph : shape.getTextParagraphs()) {
            out.add(new ParagraphContainer(region, paragraph));
        }
    }

    @Override
    public DocumentFormat getFormat() {
        return DocumentFormat.PPTX;
    }

    @Override
    public List<TextContainer> getContainers() {
        return containers;
    }

    @Override
    public void write(OutputStream out) throws IOException {
        slideShow.write(out);
    }

    @Override
    public void close() throws IOException {
        slideShow.close();
    }

    static final class ParagraphContainer extends AbstractTextContainer<XSLFTextRun> {
        private final XSLFTextParagraph paragraph;

        ParagraphContainer(String region, XSLFTextParagraph paragraph) {
            super(region, paragraph.getTextRuns());
            this.paragraph = paragraph;
        }

        @Override
        protected String read(XSLFTextRun run) {
            return run.getRawText();
        }

        @Override
        protected void write(XSLFTextRun run, String text) {
            run.setText(text);
        }

        @Override
        protected boolean isPlainText(XSLFTextRun run) {
            return run.getClass() == XSLFTextRun.class && run.getXmlObject() instanceof CTRegularTextRun;
        }

        @Override
        protected void detach(XSLFTextRun run) {
            paragraph.removeTextRun(run);
        }
    }
}
