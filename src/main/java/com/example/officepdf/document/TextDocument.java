package com.example.officepdf.document;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Format-neutral view of a template package: its text containers in a fixed
 * traversal order and a way to write the (possibly edited) package back out.
 * The container list is built once when the document is opened and is stable
 * for the lifetime of the instance.
 */
public interface TextDocument extends Closeable {

    DocumentFormat getFormat();

    List<TextContainer> getContainers();

    void write(OutputStream out) throws IOException;
}
