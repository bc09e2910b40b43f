package com.example.officepdf.document;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Text document held in plain lists, for engine tests without POI. Spans whose
 * text starts with {@code #} are structural and cannot be removed.
 */
class InMemoryTextDocument implements TextDocument {
    private final List<TextContainer> containers = new ArrayList<>();

    InMemoryTextDocument container(String... spans) {
        containers.add(Container.of("body", Arrays.asList(spans)));
        return this;
    }

    Container get(int index) {
        return (Container) containers.get(index);
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
        for (TextContainer container : containers) {
            out.write((container.text() + "\n").getBytes(StandardCharsets.UTF_8));
        }
    }

    @Override
    public void close() {
    }

    static final class Span {
        String text;
        final boolean structural;
        boolean detached;

        Span(String text) {
            this.structural = text.startsWith("#");
            this.text = structural ? text.substring(1) : text;
        }
    }

    static final class Container extends AbstractTextContainer<Span> {
        final List<Span> spans;

        private Container(String region, List<Span> spans) {
            super(region, spans);
            this.spans = spans;
        }

        static Container of(String region, List<String> texts) {
            List<Span> spans = new ArrayList<>();
            for (String text : texts) {
                spans.add(new Span(text));
            }
            return new Container(region, spans);
        }

        long detachedCount() {
            return spans.stream().filter(s -> s.detached).count();
        }

        boolean isDetached(int index) {
            return spans.get(index).detached;
        }

        @Override
        protected String read(Span span) {
            return span.text;
        }

        @Override
        protected void write(Span span, String text) {
            span.text = text;
        }

        @Override
        protected boolean isPlainText(Span span) {
            return !span.structural;
        }

        @Override
        protected void detach(Span span) {
            span.detached = true;
        }
    }
}
