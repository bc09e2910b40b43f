package com.example.officepdf.service;

import com.example.officepdf.config.BatchProperties;
import com.example.officepdf.datasource.CsvDataSource;
import com.example.officepdf.datasource.DataSourceResolver;
import com.example.officepdf.datasource.SpreadsheetDataSource;
import com.example.officepdf.document.DocumentFormat;
import com.example.officepdf.document.DocxTextDocument;
import com.example.officepdf.document.TextContainer;
import com.example.officepdf.document.TextDocumentFactory;
import com.example.officepdf.document.TokenScanner;
import com.example.officepdf.document.TokenSubstitutionEngine;
import com.example.officepdf.exception.PreflightFailedException;
import com.example.officepdf.exception.RendererException;
import com.example.officepdf.exception.TemplateProcessingException;
import com.example.officepdf.filter.FilterRegistry;
import com.example.officepdf.mapper.ValueResolver;
import com.example.officepdf.model.BatchReport;
import com.example.officepdf.model.BatchRequest;
import com.example.officepdf.model.RowReport;
import com.example.officepdf.model.RowStatus;
import com.example.officepdf.preflight.PreflightResult;
import com.example.officepdf.preflight.PreflightValidator;
import com.example.officepdf.renderer.LibreOfficeCommand;
import com.example.officepdf.renderer.PdfRenderer;
import com.example.officepdf.renderer.RendererResolver;
import com.example.officepdf.renderer.RendererType;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class BatchOrchestratorTest {

    @TempDir
    Path tempDir;

    private Path templateDir;
    private Path outputDir;
    private Path dataFile;
    private BatchProperties properties;
    private FakeRenderer renderer;
    private BatchOrchestrator orchestrator;

    /**
     * Writes a one-page PDF per call and keeps the text of the filled document it received.
     */
    static final class FakeRenderer implements PdfRenderer {
        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger active = new AtomicInteger();
        final AtomicInteger maxActive = new AtomicInteger();
        final Map<String, String> renderedText = new ConcurrentHashMap<>();
        volatile long delayMillis;
        volatile int failuresLeft;
        volatile boolean ignoreInterrupts;
        final AtomicInteger finished = new AtomicInteger();

        @Override
        public String getName() {
            return "fake";
        }

        @Override
        public boolean supports(RendererType type, DocumentFormat format) {
            return true;
        }

        @Override
        public boolean isReentrant() {
            return false;
        }

        @Override
        public Path render(Path document, Path outputDir) throws RendererException {
            calls.incrementAndGet();
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                if (delayMillis > 0 && ignoreInterrupts) {
                    sleepThroughInterrupts(delayMillis);
                } else if (delayMillis > 0) {
                    Thread.sleep(delayMillis);
                }
                if (failuresLeft > 0) {
                    failuresLeft--;
                    throw new RendererException("export failed");
                }
                try (InputStream in = new FileInputStream(document.toFile());
                     DocxTextDocument filled = DocxTextDocument.open(in, true)) {
                    renderedText.put(document.getFileName().toString(), filled.getContainers().stream()
                            .map(TextContainer::text)
                            .collect(Collectors.joining("\n")));
                }
                Path pdf = outputDir.resolve("out.pdf");
                try (PDDocument pdfDocument = new PDDocument()) {
                    pdfDocument.addPage(new PDPage());
                    pdfDocument.save(pdf.toFile());
                }
                return pdf;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RendererException("interrupted", e);
            } catch (IOException e) {
                throw new RendererException(e.getMessage(), e);
            } finally {
                active.decrementAndGet();
                finished.incrementAndGet();
            }
        }

        private static void sleepThroughInterrupts(long millis) {
            long until = System.currentTimeMillis() + millis;
            long left;
            while ((left = until - System.currentTimeMillis()) > 0) {
                try {
                    Thread.sleep(left);
                } catch (InterruptedException ignored) {
                    // keep rendering like a process that does not react to interrupts
                }
            }
        }
    }

    @BeforeEach
    public void setup() throws IOException {
        templateDir = Files.createDirectory(tempDir.resolve("templates"));
        outputDir = tempDir.resolve("out");
        dataFile = tempDir.resolve("data.csv");

        TemplateScanServiceTest.writeDocx(templateDir.resolve("letter.docx"),
                "Dear {{Name|upper}} from {{City?:Madrid}}");
        TemplateScanServiceTest.writeDocx(templateDir.resolve("phone.docx"), "Call {{Phone}}");
        writeData("TEMPLATE,Name,City,SKIP,OUTPUT",
                "letter.docx,Ana,,,",
                "letter.docx,Luis,Paris,x,",
                ",Eva,Rome,,group",
                "missing.docx,Bob,,,");

        properties = new BatchProperties();
        properties.setExportRetries(0);
        properties.setRowTimeout(Duration.ofSeconds(30));
        renderer = new FakeRenderer();

        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager();
        TextDocumentFactory documentFactory = new TextDocumentFactory(true, true);
        TokenScanner scanner = new TokenScanner();
        orchestrator = new BatchOrchestrator(
                properties,
                new DataSourceResolver(List.of(new CsvDataSource(), new SpreadsheetDataSource())),
                new RowSelector(),
                new TemplateResolver(),
                new TemplateScanService(documentFactory, scanner,
                        new TemplateNormalizer(mock(LibreOfficeCommand.class), cacheManager), cacheManager),
                new PreflightValidator(properties),
                new DocumentFiller(documentFactory, scanner, new ValueResolver(FilterRegistry.withDefaults()),
                        new TokenSubstitutionEngine()),
                new OutputNameResolver(),
                new RendererResolver(List.of(renderer)),
                new PdfInspector(),
                new ReportWriter());
    }

    private void writeData(String... lines) throws IOException {
        Files.writeString(dataFile, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    }

    private BatchRequest.BatchRequestBuilder request() {
        return BatchRequest.builder()
                .templateDir(templateDir.toString())
                .dataPath(dataFile.toString())
                .outputDir(outputDir.toString())
                .filenamePattern("{index:04d}_{Name}.pdf");
    }

    @Test
    public void testRunProducesOneRecordPerRow() throws IOException {
        BatchReport report = orchestrator.run(request().build());
        List<RowReport> rows = report.getRows();

        assertEquals(4, rows.size());
        RowReport ok = rows.get(0);
        assertEquals(RowStatus.OK, ok.getStatus());
        assertEquals("letter.docx", ok.getTemplateName());
        assertEquals(outputDir.resolve("0000_Ana.pdf").toString(), ok.getOutputPath());
        assertEquals(1, ok.getPages());
        assertEquals(Files.size(outputDir.resolve("0000_Ana.pdf")), ok.getBytes());
        assertEquals("Dear ANA from Madrid", renderer.renderedText.get("row-0.docx"));

        assertEquals(RowStatus.SKIPPED, rows.get(1).getStatus());
        assertEquals(RowStatus.ERROR, rows.get(2).getStatus());
        assertTrue(rows.get(2).getError().contains("TEMPLATE"));
        assertEquals(RowStatus.ERROR, rows.get(3).getStatus());
        assertEquals("missing.docx", rows.get(3).getTemplateName());

        assertEquals(1, renderer.calls.get());
        assertTrue(report.hasErrors());
        assertTrue(report.getPreflight().getMissingTemplates().contains("missing.docx"));
        assertTrue(Files.isRegularFile(outputDir.resolve("_report.json")));
        assertTrue(Files.isRegularFile(outputDir.resolve("_report.csv")));
    }

    @Test
    public void testDefaultTemplateAndOutputSubfolder() {
        BatchReport report = orchestrator.run(request().defaultTemplate("letter.docx").fromRow(2).toRow(2).build());

        RowReport row = report.getRows().get(0);
        assertEquals(RowStatus.OK, row.getStatus());
        assertEquals(outputDir.resolve("group").resolve("0002_Eva.pdf").toString(), row.getOutputPath());
        assertTrue(Files.isRegularFile(outputDir.resolve("group").resolve("0002_Eva.pdf")));
        assertEquals("Dear EVA from Rome", renderer.renderedText.get("row-2.docx"));
    }

    @Test
    public void testWhereFilterSelectsRows() {
        BatchReport report = orchestrator.run(request().where("Name == 'Ana'").build());

        assertEquals(1, report.getRows().size());
        assertEquals(0, report.getRows().get(0).getRowIndex());
    }

    @Test
    public void testDryRunRendersNothing() {
        BatchReport report = orchestrator.run(request().dryRun(true).build());

        assertTrue(report.isDryRun());
        assertEquals(RowStatus.DRY_RUN, report.getRows().get(0).getStatus());
        assertEquals(RowStatus.SKIPPED, report.getRows().get(1).getStatus());
        assertEquals(0, renderer.calls.get());
        assertFalse(Files.exists(outputDir.resolve("0000_Ana.pdf")));
    }

    @Test
    public void testStrictModeFailsRowWithMissingField() throws IOException {
        writeData("TEMPLATE,Name", "phone.docx,Ana", "letter.docx,Luis");

        BatchReport lenient = orchestrator.run(request().build());
        assertEquals(RowStatus.OK, lenient.getRows().get(0).getStatus());
        assertEquals("Call ", renderer.renderedText.get("row-0.docx"));
        assertEquals(Set.of("Phone"), lenient.getPreflight().getMissingColumns());

        BatchReport strict = orchestrator.run(request().strict(true).build());
        assertEquals(RowStatus.ERROR, strict.getRows().get(0).getStatus());
        assertTrue(strict.getRows().get(0).getError().contains("Phone"));
        assertEquals(RowStatus.OK, strict.getRows().get(1).getStatus());
    }

    @Test
    public void testFailOnMissingColumnsAbortsBeforeAnyRow() throws IOException {
        writeData("TEMPLATE,Name", "phone.docx,Ana", "letter.docx,Luis");

        PreflightFailedException e = assertThrows(PreflightFailedException.class,
                () -> orchestrator.run(request().failOnMissingColumns(true).build()));
        assertTrue(e.getResult().getMissingColumns().contains("Phone"));
        assertEquals(0, renderer.calls.get());
        assertFalse(Files.exists(outputDir));
    }

    @Test
    public void testPreflightOnly() throws IOException {
        writeData("TEMPLATE,Name,Extra", "phone.docx,Ana,1");

        PreflightResult result = orchestrator.preflight(request().build());

        assertEquals(Set.of("Phone"), result.getMissingColumns());
        assertEquals(Set.of("Name", "Extra"), result.getUnusedColumns());
        assertTrue(result.getPerTemplateTokens().containsKey("phone.docx"));
        assertEquals(0, renderer.calls.get());
    }

    @Test
    public void testMissingTemplateColumn() throws IOException {
        writeData("Name", "Ana");

        TemplateProcessingException e = assertThrows(TemplateProcessingException.class,
                () -> orchestrator.run(request().build()));
        assertEquals("MISSING_REQUIRED_COLUMNS", e.getCode());
    }

    @Test
    public void testRenderIsRetried() {
        renderer.failuresLeft = 1;

        BatchReport report = orchestrator.run(request().exportRetries(1).toRow(0).build());

        assertEquals(RowStatus.OK, report.getRows().get(0).getStatus());
        assertEquals(2, renderer.calls.get());
    }

    @Test
    public void testRenderFailureBecomesRowError() {
        renderer.failuresLeft = 5;

        BatchReport report = orchestrator.run(request().exportRetries(1).toRow(0).build());

        assertEquals(RowStatus.ERROR, report.getRows().get(0).getStatus());
        assertEquals("export failed", report.getRows().get(0).getError());
        assertEquals(2, renderer.calls.get());
    }

    @Test
    public void testRowTimeout() {
        properties.setRowTimeout(Duration.ofMillis(200));
        renderer.delayMillis = 5000;

        BatchReport report = orchestrator.run(request().toRow(0).build());

        assertEquals(RowStatus.ERROR, report.getRows().get(0).getStatus());
        assertTrue(report.getRows().get(0).getError().startsWith("timed out after"));
    }

    @Test
    public void testCancelledBatchSkipsRemainingRows() {
        BatchCancellation cancellation = new BatchCancellation();
        cancellation.cancel();

        BatchReport report = orchestrator.run(request().build(), cancellation);

        assertTrue(report.isCancelled());
        assertEquals(4, report.getRows().size());
        for (RowReport row : report.getRows()) {
            assertEquals(RowStatus.SKIPPED, row.getStatus());
            assertEquals(List.of(BatchOrchestrator.CANCELLED_WARNING), row.getWarnings());
        }
        assertEquals(0, renderer.calls.get());
    }

    @Test
    public void testParallelRowsShareOneRendererSlot() throws IOException {
        writeData("TEMPLATE,Name", "letter.docx,A", "letter.docx,B", "letter.docx,C", "letter.docx,D");
        renderer.delayMillis = 50;

        BatchReport report = orchestrator.run(request().parallelism(4).build());

        assertEquals(4, report.getRows().size());
        for (int i = 0; i < 4; i++) {
            assertEquals(i, report.getRows().get(i).getRowIndex());
            assertEquals(RowStatus.OK, report.getRows().get(i).getStatus());
        }
        assertEquals(1, renderer.maxActive.get());
    }

    @Test
    public void testQueueingAtRendererDoesNotCountTowardsRowTimeout() throws IOException {
        writeData("TEMPLATE,Name", "letter.docx,A", "letter.docx,B", "letter.docx,C", "letter.docx,D");
        properties.setRowTimeout(Duration.ofMillis(1500));
        renderer.delayMillis = 600;

        BatchReport report = orchestrator.run(request().parallelism(4).build());

        for (RowReport row : report.getRows()) {
            assertEquals(RowStatus.OK, row.getStatus(), String.valueOf(row.getError()));
            assertTrue(Files.isRegularFile(Path.of(row.getOutputPath())));
        }
        assertEquals(4, renderer.calls.get());
        assertEquals(1, renderer.maxActive.get());
    }

    @Test
    public void testTimedOutRowNeverPublishesItsPdf() throws Exception {
        writeData("TEMPLATE,Name", "letter.docx,A");
        properties.setRowTimeout(Duration.ofMillis(200));
        renderer.delayMillis = 800;
        renderer.ignoreInterrupts = true;

        BatchReport report = orchestrator.run(request().build());

        RowReport row = report.getRows().get(0);
        assertEquals(RowStatus.ERROR, row.getStatus());
        assertTrue(row.getError().startsWith("timed out after"));

        long until = System.currentTimeMillis() + 5000;
        while (renderer.finished.get() == 0 && System.currentTimeMillis() < until) {
            Thread.sleep(50);
        }
        assertEquals(1, renderer.finished.get());
        Thread.sleep(500);
        try (Stream<Path> files = Files.list(outputDir)) {
            assertTrue(files.noneMatch(f -> f.toString().endsWith(".pdf")));
        }
    }
}
