package com.example.officepdf.datasource;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * UTF-8 CSV reader with a header row. A leading byte-order mark is ignored;
 * short rows are padded with empty values.
 */
@Slf4j
@Component
public class CsvDataSource implements TabularDataSource {
    private static final char BOM = '\uFEFF';

    private final CsvMapper mapper = new CsvMapper();

    @Override
    public boolean supports(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    @Override
    public DataTable read(Path file, String sheet) throws IOException {
        List<String[]> records = new ArrayList<>();
        List<String> rawHeader;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = mapper.readerFor(String[].class)
                     .with(CsvParser.Feature.WRAP_AS_ARRAY)
                     .readValues(reader)) {
            if (!it.hasNextValue()) {
                return new DataTable(file.toString(), Collections.emptyList(), Collections.emptyList());
            }
            rawHeader = new ArrayList<>(List.of(it.nextValue()));
            while (it.hasNextValue()) {
                records.add(it.nextValue());
            }
        }
        if (!rawHeader.isEmpty() && !rawHeader.get(0).isEmpty() && rawHeader.get(0).charAt(0) == BOM) {
            rawHeader.set(0, rawHeader.get(0).substring(1));
        }
        List<String> columns = ColumnNames.normalize(rawHeader);

        List<Map<String, String>> rows = new ArrayList<>();
        for (String[] record : records) {
            Map<String, String> values = new LinkedHashMap<>();
            boolean blank = true;
            for (int c = 0; c < columns.size(); c++) {
                String value = c < record.length && record[c] != null ? record[c].strip() : "";
                blank &= value.isEmpty();
                values.put(columns.get(c), value);
            }
            if (!blank) {
                rows.add(Collections.unmodifiableMap(values));
            }
        }
        log.info("Loaded {} rows x {} columns from {}", rows.size(), columns.size(), file.getFileName());
        return new DataTable(file.toString(), Collections.unmodifiableList(columns), Collections.unmodifiableList(rows));
    }
}
