package com.example.officepdf.document;

/**
 * An ordered sequence of text spans, the smallest unit inside which a token may be
 * split: a paragraph of a word-processing document, a text paragraph of a slide.
 *
 * Spans are addressed by their position when the container was opened. A removed
 * span keeps its index and reads as the empty string, so positions computed by a
 * scan stay valid while the container is edited.
 */
public interface TextContainer {

    /**
     * Where the container lives, e.g. {@code body}, {@code header[1]}, {@code slide[3]}.
     */
    String getRegion();

    int spanCount();

    String spanText(int index);

    void setSpanText(int index, String text);

    /**
     * Detach the span from the document if it carries nothing but text.
     *
     * @return false when the span holds structure (field, hyperlink, break, drawing)
     *         and was left in place
     */
    boolean removeSpan(int index);

    default String text() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < spanCount(); i++) {
            sb.append(spanText(i));
        }
        return sb.toString();
    }
}
