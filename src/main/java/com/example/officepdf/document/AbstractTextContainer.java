package com.example.officepdf.document;

import java.util.ArrayList;
import java.util.List;

/**
 * Index-addressed span arena shared by the format adapters. Subclasses say how to
 * read, write and detach one native run.
 *
 * @param <R> native run type
 */
abstract class AbstractTextContainer<R> implements TextContainer {
    private final String region;
    private final List<R> spans;
    private final boolean[] removed;

    protected AbstractTextContainer(String region, List<R> spans) {
        this.region = region;
        this.spans = new ArrayList<>(spans);
        this.removed = new boolean[this.spans.size()];
    }

    protected abstract String read(R span);

    protected abstract void write(R span, String text);

    protected abstract boolean isPlainText(R span);

    protected abstract void detach(R span);

    @Override
    public String getRegion() {
        return region;
    }

    @Override
    public int spanCount() {
        return spans.size();
    }

    @Override
    public String spanText(int index) {
        if (removed[index]) {
            return "";
        }
        String text = read(spans.get(index));
        return text == null ? "" : text;
    }

    @Override
    public void setSpanText(int index, String text) {
        if (removed[index]) {
            if (!text.isEmpty()) {
                throw new IllegalStateException("Span " + index + " of " + region + " was removed");
            }
            return;
        }
        write(spans.get(index), text);
    }

    @Override
    public boolean removeSpan(int index) {
        if (removed[index]) {
            return true;
        }
        R span = spans.get(index);
        if (!isPlainText(span)) {
            return false;
        }
        detach(span);
        removed[index] = true;
        return true;
    }

    @Override
    public String toString() {
        return region + ": " + text();
    }
}
