package com.example.officepdf.service;

import com.example.officepdf.model.RowReport;
import com.example.officepdf.model.RowStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ReportWriterTest {

    @TempDir
    Path tempDir;

    private final ReportWriter writer = new ReportWriter();

    private final List<RowReport> rows = List.of(
            RowReport.builder().rowIndex(0).status(RowStatus.OK).templateName("letter.docx")
                    .outputPath("out/0000.pdf").bytes(1024L).pages(2)
                    .warnings(List.of("{{Amount|currency}} not a number", "second")).build(),
            RowReport.builder().rowIndex(1).status(RowStatus.DRY_RUN).templateName("letter.docx").build(),
            RowReport.builder().rowIndex(2).status(RowStatus.ERROR).error("Template file not found").build());

    @Test
    public void testJsonReport() throws IOException {
        Path file = tempDir.resolve("_report.json");
        assertTrue(writer.writeJson(file, rows));

        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertEquals(3, json.size());
        assertEquals(0, json.get(0).get("row").asInt());
        assertEquals("OK", json.get(0).get("status").asText());
        assertEquals("out/0000.pdf", json.get(0).get("output").asText());
        assertEquals(2, json.get(0).get("pages").asInt());
        assertEquals("DRY-RUN", json.get(1).get("status").asText());
        assertFalse(json.get(1).has("bytes"));
        assertFalse(json.get(1).has("error"));
        assertEquals("Template file not found", json.get(2).get("error").asText());
    }

    @Test
    public void testCsvReport() throws IOException {
        Path file = tempDir.resolve("nested").resolve("_report.csv");
        assertTrue(writer.writeCsv(file, rows));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(4, lines.size());
        assertEquals("row,status,template,output,bytes,pages,error,warnings", lines.get(0));

        List<Map<String, String>> records;
        try (MappingIterator<Map<String, String>> it = new CsvMapper().readerFor(Map.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(file.toFile())) {
            records = it.readAll();
        }
        assertEquals("0", records.get(0).get("row"));
        assertEquals("1024", records.get(0).get("bytes"));
        assertEquals("{{Amount|currency}} not a number" + ReportWriter.WARNING_SEPARATOR + "second",
                records.get(0).get("warnings"));
        assertEquals("DRY-RUN", records.get(1).get("status"));
        assertEquals("", records.get(1).get("pages"));
        assertEquals("ERROR", records.get(2).get("status"));
        assertEquals("Template file not found", records.get(2).get("error"));
        assertEquals("", records.get(2).get("template"));
    }

    @Test
    public void testUnwritableLocationIsReported() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        assertFalse(writer.writeJson(blocker.resolve("_report.json"), rows));
        assertFalse(writer.writeCsv(blocker.resolve("_report.csv"), rows));
    }
}
