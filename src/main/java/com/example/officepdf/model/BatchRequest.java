package com.example.officepdf.model;

import com.example.officepdf.config.BatchProperties;
import com.example.officepdf.renderer.RendererType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One batch run. Null fields fall back to {@link BatchProperties}; also the shape
 * of a YAML job file and of the REST request body.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BatchRequest {
    private String templateDir;
    private String dataPath;
    private String outputDir;
    private String sheet;
    private String filenamePattern;
    private String defaultTemplate;
    private Boolean dryRun;
    private Boolean strict;
    private Boolean failOnMissingColumns;
    private RendererType renderer;

    /**
     * First row index to process (zero-based, inclusive).
     */
    private Integer fromRow;

    /**
     * Last row index to process (inclusive).
     */
    private Integer toRow;

    /**
     * Row predicate, e.g. {@code COURSE == 'A' and ['Full Name'] != ''}.
     */
    private String where;

    private Integer parallelism;
    private Integer exportRetries;

    /**
     * Copy with every unset field taken from the configured defaults.
     */
    public BatchRequest resolvedWith(BatchProperties defaults) {
        return toBuilder()
                .templateDir(templateDir != null ? templateDir : defaults.getTemplateDir())
                .dataPath(dataPath != null ? dataPath : defaults.getDataPath())
                .outputDir(outputDir != null ? outputDir : defaults.getOutputDir())
                .sheet(sheet != null ? sheet : defaults.getSheet())
                .filenamePattern(filenamePattern != null ? filenamePattern : defaults.getFilenamePattern())
                .defaultTemplate(defaultTemplate != null ? defaultTemplate : defaults.getDefaultTemplate())
                .dryRun(dryRun != null ? dryRun : defaults.isDryRun())
                .strict(strict != null ? strict : defaults.isStrict())
                .failOnMissingColumns(failOnMissingColumns != null ? failOnMissingColumns : defaults.isFailOnMissingColumns())
                .renderer(renderer != null ? renderer : defaults.getRenderer())
                .parallelism(parallelism != null ? parallelism : defaults.getParallelism())
                .exportRetries(exportRetries != null ? exportRetries : defaults.getExportRetries())
                .build();
    }
}
