package com.example.officepdf.datasource;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads a data file into a {@link DataTable}. Every cell type is turned into
 * text the same way before any row reaches the token engine.
 */
public interface TabularDataSource {

    boolean supports(Path file);

    /**
     * @param sheet sheet name or zero-based index; ignored by formats without sheets
     */
    DataTable read(Path file, String sheet) throws IOException;
}
