package com.example.officepdf.datasource;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvDataSourceTest {

    @TempDir
    Path tempDir;

    private final CsvDataSource source = new CsvDataSource();

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("data.csv");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testSupportsCsvOnly() {
        assertTrue(source.supports(Path.of("people.CSV")));
        assertFalse(source.supports(Path.of("people.xlsx")));
    }

    @Test
    public void testReadsHeaderAndRows() throws IOException {
        DataTable table = source.read(write("TEMPLATE,Name,Amount\nletter.docx, Ana ,\"1,234.50\"\n"), null);

        assertEquals(List.of("TEMPLATE", "Name", "Amount"), table.getColumns());
        assertEquals(1, table.size());
        assertEquals("Ana", table.getRows().get(0).get("Name"));
        assertEquals("1,234.50", table.getRows().get(0).get("Amount"));
    }

    @Test
    public void testByteOrderMarkIsIgnored() throws IOException {
        DataTable table = source.read(write("\uFEFFName,City\nAna,Madrid\n"), null);

        assertEquals("Name", table.getColumns().get(0));
        assertEquals("Ana", table.getRows().get(0).get("Name"));
    }

    @Test
    public void testShortRowsArePaddedAndBlankRowsSkipped() throws IOException {
        DataTable table = source.read(write("A,B,C\n1\n,,\n2,x,y\n"), null);

        assertEquals(2, table.size());
        assertEquals("1", table.getRows().get(0).get("A"));
        assertEquals("", table.getRows().get(0).get("C"));
        assertEquals("y", table.getRows().get(1).get("C"));
    }

    @Test
    public void testHeaderNamesAreNormalized() throws IOException {
        DataTable table = source.read(write(" Name ,,Name\na,b,c\n"), null);

        assertEquals(List.of("Name", "Unnamed: 1", "Name.1"), table.getColumns());
        assertEquals("c", table.getRows().get(0).get("Name.1"));
    }

    @Test
    public void testEmptyFileYieldsEmptyTable() throws IOException {
        DataTable table = source.read(write(""), null);

        assertTrue(table.getColumns().isEmpty());
        assertEquals(0, table.size());
    }
}
