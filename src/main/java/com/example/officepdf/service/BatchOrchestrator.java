package com.example.officepdf.service;

import com.example.officepdf.aspect.LogExecutionTime;
import com.example.officepdf.config.BatchProperties;
import com.example.officepdf.datasource.DataSourceResolver;
import com.example.officepdf.datasource.DataTable;
import com.example.officepdf.document.DocumentFormat;
import com.example.officepdf.exception.PreflightFailedException;
import com.example.officepdf.exception.RendererException;
import com.example.officepdf.exception.TemplateProcessingException;
import com.example.officepdf.expression.TokenExpression;
import com.example.officepdf.mapper.ResolveException;
import com.example.officepdf.mapper.RowValues;
import com.example.officepdf.model.BatchReport;
import com.example.officepdf.model.BatchRequest;
import com.example.officepdf.model.RowReport;
import com.example.officepdf.model.RowStatus;
import com.example.officepdf.model.TemplateScan;
import com.example.officepdf.preflight.PreflightResult;
import com.example.officepdf.preflight.PreflightValidator;
import com.example.officepdf.renderer.RendererGate;
import com.example.officepdf.renderer.RendererResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Runs a batch: loads the data, selects rows, scans every template the selected
 * rows use, runs preflight once, then fills and renders each row.
 *
 * Every selected row yields exactly one {@link RowReport}. Per-row failures become
 * {@code ERROR} records; only data-source problems, unreadable templates, a missing
 * renderer and preflight in fail-fast mode abort the whole batch.
 *
 * Rows are dispatched to {@code parallelism} workers. Each row runs under the
 * configured timeout, not counting time spent queueing at the renderer's gate.
 * A row that times out never publishes its PDF. Cancellation
 * is checked before a row starts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchOrchestrator {
    static final Set<String> SKIP_VALUES = Set.of("1", "true", "sí", "si", "x", "y", "yes");
    static final String CANCELLED_WARNING = "batch cancelled";

    private final BatchProperties properties;
    private final DataSourceResolver dataSources;
    private final RowSelector rowSelector;
    private final TemplateResolver templateResolver;
    private final TemplateScanService scanService;
    private final PreflightValidator preflightValidator;
    private final DocumentFiller documentFiller;
    private final OutputNameResolver outputNames;
    private final RendererResolver rendererResolver;
    private final PdfInspector pdfInspector;
    private final ReportWriter reportWriter;

    @LogExecutionTime("Batch Preflight")
    public PreflightResult preflight(BatchRequest request) {
        BatchRequest resolved = request.resolvedWith(properties);
        return plan(resolved).preflight;
    }

    public BatchReport run(BatchRequest request) {
        return run(request, new BatchCancellation());
    }

    @LogExecutionTime("Batch Run")
    public BatchReport run(BatchRequest request, BatchCancellation cancellation) {
        BatchRequest resolved = request.resolvedWith(properties);
        BatchPlan plan = plan(resolved);

        if (Boolean.TRUE.equals(resolved.getFailOnMissingColumns()) && plan.preflight.hasMissingColumns()) {
            throw new PreflightFailedException(plan.preflight);
        }

        Path outputDir = Path.of(resolved.getOutputDir());
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new TemplateProcessingException("INVALID_REQUEST",
                    "Cannot create output directory " + outputDir + ": " + e.getMessage(), e);
        }

        boolean dryRun = Boolean.TRUE.equals(resolved.getDryRun());
        Map<DocumentFormat, RendererGate> gates = new EnumMap<>(DocumentFormat.class);
        if (!dryRun) {
            for (TemplateScan scan : plan.scans.values()) {
                gates.computeIfAbsent(scan.getFormat(), f -> rendererResolver.resolve(resolved.getRenderer(), f));
            }
        }

        RowContext context = new RowContext(resolved, plan, outputDir, gates, dryRun);
        List<RowReport> rows = execute(context, cancellation);

        BatchReport report = BatchReport.builder()
                .preflight(plan.preflight)
                .rows(rows)
                .cancelled(cancellation.isCancelled())
                .dryRun(dryRun)
                .build();
        reportWriter.writeJson(outputDir.resolve(properties.getJsonReportName()), rows);
        reportWriter.writeCsv(outputDir.resolve(properties.getCsvReportName()), rows);
        log.info("Batch finished: {}", report.countByStatus());
        return report;
    }

    private BatchPlan plan(BatchRequest request) {
        DataTable table = dataSources.load(Path.of(request.getDataPath()), request.getSheet());
        boolean caseInsensitive = properties.isCaseInsensitiveColumns();
        String defaultTemplate = request.getDefaultTemplate();

        if (!table.hasColumn(properties.getTemplateColumn(), caseInsensitive)
                && (defaultTemplate == null || defaultTemplate.isBlank())) {
            throw new TemplateProcessingException("MISSING_REQUIRED_COLUMNS",
                    "Missing required column '" + properties.getTemplateColumn() + "'. Available: " + table.getColumns());
        }

        List<Integer> selected = rowSelector.select(table, request.getFromRow(), request.getToRow(), request.getWhere());
        Map<Integer, RowValues> rows = new LinkedHashMap<>();
        for (Integer index : selected) {
            rows.put(index, RowValues.of(table.getRows().get(index), caseInsensitive));
        }

        Path templateDir = Path.of(request.getTemplateDir());
        Map<String, TemplateScan> scans = new TreeMap<>();
        Map<String, String> unresolved = new TreeMap<>();
        for (RowValues row : rows.values()) {
            if (isSkipped(row)) {
                continue;
            }
            String name = templateResolver.effectiveName(cell(row, properties.getTemplateColumn()), defaultTemplate);
            if (name.isEmpty() || scans.containsKey(name) || unresolved.containsKey(name)) {
                continue;
            }
            Path path;
            try {
                path = templateResolver.resolve(templateDir, name);
            } catch (TemplateProcessingException e) {
                log.warn("Template '{}' unavailable: {}", name, e.getDescription());
                unresolved.put(name, e.getDescription());
                continue;
            }
            scans.put(name, scanService.scan(name, path));
        }

        Map<String, Set<TokenExpression>> tokens = new TreeMap<>();
        scans.forEach((name, scan) -> tokens.put(name, scan.getExpressions()));
        PreflightResult.PreflightResultBuilder preflight = preflightValidator
                .validate(tokens, table.getColumns())
                .toBuilder()
                .missingTemplates(unresolved.keySet());
        scans.forEach((name, scan) -> {
            if (scan.hasParseFailures()) {
                preflight.parseFailure(name, scan.getParseFailures());
            }
        });

        PreflightResult result = preflight.build();
        log.info("[Preflight] templates: {}, rows selected: {} of {}", scans.keySet(), rows.size(), table.size());
        if (!result.getMissingTemplates().isEmpty()) {
            log.warn("[Preflight] templates not found: {}", result.getMissingTemplates());
        }
        return new BatchPlan(table, rows, scans, unresolved, result);
    }

    private List<RowReport> execute(RowContext context, BatchCancellation cancellation) {
        List<Map.Entry<Integer, RowValues>> rows = new ArrayList<>(context.plan.rows.entrySet());
        int total = rows.size();
        log.info("Rows to process: {}", total);

        int parallelism = Math.max(1, context.request.getParallelism());
        ExecutorService dispatch = Executors.newFixedThreadPool(parallelism);
        ExecutorService execution = Executors.newCachedThreadPool();
        List<Future<RowReport>> futures = new ArrayList<>(total);
        try {
            for (int position = 0; position < total; position++) {
                Map.Entry<Integer, RowValues> entry = rows.get(position);
                String progress = "[" + (position + 1) + "/" + total + "]";
                futures.add(dispatch.submit(() -> dispatchRow(context, entry.getKey(), entry.getValue(),
                        progress, cancellation, execution)));
            }

            List<RowReport> reports = new ArrayList<>(total);
            for (int position = 0; position < total; position++) {
                int rowIndex = rows.get(position).getKey();
                try {
                    reports.add(futures.get(position).get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancellation.cancel();
                    reports.add(cancelled(rowIndex));
                } catch (ExecutionException e) {
                    reports.add(error(rowIndex, null, null, rootMessage(e.getCause())));
                }
            }
            reports.sort(Comparator.comparingInt(RowReport::getRowIndex));
            return reports;
        } finally {
            dispatch.shutdownNow();
            execution.shutdownNow();
        }
    }

    private RowReport dispatchRow(RowContext context, int rowIndex, RowValues row, String progress,
                                  BatchCancellation cancellation, ExecutorService execution) {
        if (cancellation.isCancelled()) {
            return cancelled(rowIndex);
        }
        RowDeadline deadline = new RowDeadline(properties.getRowTimeout());
        Future<RowReport> future = execution.submit(() -> processRow(context, rowIndex, row, progress, deadline));
        try {
            while (true) {
                try {
                    return future.get(Math.max(1, deadline.remainingMillis()), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    if (deadline.remainingMillis() > 0) {
                        continue;
                    }
                    if (!deadline.expire()) {
                        // output is being published; let the row finish
                        return future.get();
                    }
                    future.cancel(true);
                    String message = "timed out after " + deadline.getBudget().toSeconds() + "s";
                    log.error("{} [ERROR] Row {} {}", progress, rowIndex, message);
                    return error(rowIndex, null, null, message);
                }
            }
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return cancelled(rowIndex);
        } catch (ExecutionException e) {
            return error(rowIndex, null, null, rootMessage(e.getCause()));
        }
    }

    private RowReport processRow(RowContext context, int rowIndex, RowValues row, String progress,
                                 RowDeadline deadline) {
        if (isSkipped(row)) {
            log.info("{} {} set -> row skipped", progress, properties.getSkipColumn());
            return RowReport.builder().rowIndex(rowIndex).status(RowStatus.SKIPPED).build();
        }

        BatchRequest request = context.request;
        String templateName = templateResolver.effectiveName(
                cell(row, properties.getTemplateColumn()), request.getDefaultTemplate());
        if (templateName.isEmpty()) {
            return logged(progress, error(rowIndex, null, null,
                    properties.getTemplateColumn() + " is empty and no default template is configured"));
        }
        String unresolved = context.plan.unresolved.get(templateName);
        if (unresolved != null) {
            return logged(progress, error(rowIndex, templateName, null, unresolved));
        }
        TemplateScan scan = context.plan.scans.get(templateName);

        Path target;
        try {
            String fileName = outputNames.fileName(request.getFilenamePattern(), rowIndex, row);
            target = outputNames.targetPath(context.outputDir, fileName, cell(row, properties.getOutputColumn()));
        } catch (TemplateProcessingException e) {
            return logged(progress, error(rowIndex, templateName, null,
                    e.getDescription() + " | Columns: " + context.plan.table.getColumns()));
        }
        boolean strict = Boolean.TRUE.equals(request.getStrict());

        if (context.dryRun) {
            try {
                FillOutcome outcome = documentFiller.resolve(scan, row, strict);
                log.info("{} [DRY-RUN] {} -> {}", progress, templateName, target.getFileName());
                return RowReport.builder()
                        .rowIndex(rowIndex)
                        .status(RowStatus.DRY_RUN)
                        .templateName(templateName)
                        .outputPath(target.toString())
                        .warnings(withScanWarnings(scan, outcome.getWarnings()))
                        .build();
            } catch (ResolveException | TemplateProcessingException e) {
                return logged(progress, error(rowIndex, templateName, target, e.getMessage()));
            }
        }

        log.info("{} {} -> {}", progress, templateName, target.getFileName());
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("officepdf-row-");
            Path filled = workDir.resolve("row-" + rowIndex + "." + scan.getFormat().getExtension());
            FillOutcome outcome = documentFiller.fill(scan, row, strict, filled);

            Path renderDir = Files.createDirectory(workDir.resolve("pdf"));
            Path pdf = renderWithRetries(context.gates.get(scan.getFormat()), filled, renderDir,
                    request.getExportRetries(), deadline);
            int pages;
            try {
                pages = pdfInspector.countPages(pdf);
            } catch (IOException e) {
                throw new RendererException("Renderer output is not a valid PDF: " + e.getMessage(), e);
            }

            if (!deadline.commit()) {
                log.warn("Row {} timed out before its PDF was published; discarding it", rowIndex);
                return error(rowIndex, templateName, target, "timed out after " + deadline.getBudget().toSeconds() + "s");
            }
            Files.createDirectories(target.getParent());
            Files.move(pdf, target, StandardCopyOption.REPLACE_EXISTING);
            return RowReport.builder()
                    .rowIndex(rowIndex)
                    .status(RowStatus.OK)
                    .templateName(templateName)
                    .outputPath(target.toString())
                    .bytes(Files.size(target))
                    .pages(pages)
                    .warnings(outcome.getWarnings())
                    .build();
        } catch (ResolveException | TemplateProcessingException | RendererException | IOException e) {
            log.error("[ERROR] Row {} ({}) -> {}", rowIndex, templateName, e.getMessage());
            return error(rowIndex, templateName, target, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[ERROR] Row {} ({}) failed unexpectedly", rowIndex, templateName, e);
            return error(rowIndex, templateName, target, rootMessage(e));
        } finally {
            if (workDir != null) {
                deleteRecursively(workDir);
            }
        }
    }

    private Path renderWithRetries(RendererGate gate, Path filled, Path renderDir, int retries,
                                   RowDeadline deadline) throws RendererException {
        RendererException last = null;
        for (int attempt = 1; attempt <= retries + 1; attempt++) {
            try {
                return gate.render(filled, renderDir, deadline);
            } catch (RendererException e) {
                last = e;
                log.warn("PDF export attempt {} with {} failed: {}", attempt, gate.getRenderer().getName(), e.getMessage());
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
            }
        }
        throw last;
    }

    private boolean isSkipped(RowValues row) {
        String value = cell(row, properties.getSkipColumn());
        return value != null && SKIP_VALUES.contains(value.strip().toLowerCase(Locale.ROOT));
    }

    private static String cell(RowValues row, String column) {
        return row.lookup(column).orElse(null);
    }

    private static List<String> withScanWarnings(TemplateScan scan, List<String> warnings) {
        List<String> all = new ArrayList<>(warnings);
        all.addAll(scan.getWarnings());
        return all;
    }

    private static RowReport cancelled(int rowIndex) {
        List<String> warnings = new ArrayList<>();
        warnings.add(CANCELLED_WARNING);
        return RowReport.builder().rowIndex(rowIndex).status(RowStatus.SKIPPED).warnings(warnings).build();
    }

    private static RowReport error(int rowIndex, String templateName, Path target, String message) {
        return RowReport.builder()
                .rowIndex(rowIndex)
                .status(RowStatus.ERROR)
                .templateName(templateName)
                .outputPath(target == null ? null : target.toString())
                .error(message)
                .build();
    }

    private static RowReport logged(String progress, RowReport report) {
        log.error("{} [ERROR] {}", progress, report.getError());
        return report;
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getMessage() == null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.debug("Could not clean work directory {}: {}", dir, e.getMessage());
        }
    }

    private static final class BatchPlan {
        final DataTable table;
        final Map<Integer, RowValues> rows;
        final Map<String, TemplateScan> scans;
        final Map<String, String> unresolved;
        final PreflightResult preflight;

        BatchPlan(DataTable table, Map<Integer, RowValues> rows, Map<String, TemplateScan> scans,
                  Map<String, String> unresolved, PreflightResult preflight) {
            this.table = table;
            this.rows = rows;
            this.scans = scans;
            this.unresolved = unresolved;
            this.preflight = preflight;
        }
    }

    private static final class RowContext {
        final BatchRequest request;
        final BatchPlan plan;
        final Path outputDir;
        final Map<DocumentFormat, RendererGate> gates;
        final boolean dryRun;

        RowContext(BatchRequest request, BatchPlan plan, Path outputDir,
                   Map<DocumentFormat, RendererGate> gates, boolean dryRun) {
            this.request = request;
            this.plan = plan;
            this.outputDir = outputDir;
            this.gates = gates;
            this.dryRun = dryRun;
        }
    }
}
