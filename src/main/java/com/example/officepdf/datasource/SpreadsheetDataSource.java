package com.example.officepdf.datasource;

import com.example.officepdf.exception.TemplateProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * XLSX/XLS reader. The first row of the sheet holds the headers.
 *
 * Cells are rendered with POI's {@link DataFormatter} so numbers read the way the
 * sheet displays them. Date cells are written as ISO dates (date-times when they
 * carry a time of day). Formula cells use their cached result; nothing is evaluated.
 */
@Slf4j
@Component
public class SpreadsheetDataSource implements TabularDataSource {
    private final DataFormatter formatter = new DataFormatter(Locale.ROOT);

    @Override
    public boolean supports(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".xlsx") || name.endsWith(".xlsm") || name.endsWith(".xls");
    }

    @Override
    public DataTable read(Path file, String sheet) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            Sheet selected = selectSheet(workbook, sheet, file);
            Row header = selected.getRow(selected.getFirstRowNum());
            if (header == null) {
                log.warn("Sheet '{}' of {} is empty", selected.getSheetName(), file.getFileName());
                return new DataTable(file.toString(), Collections.emptyList(), Collections.emptyList());
            }

            int width = Math.max(header.getLastCellNum(), 0);
            List<String> rawNames = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                rawNames.add(cellText(header.getCell(c)));
            }
            List<String> columns = ColumnNames.normalize(rawNames);

            List<Map<String, String>> rows = new ArrayList<>();
            for (int r = header.getRowNum() + 1; r <= selected.getLastRowNum(); r++) {
                Row row = selected.getRow(r);
                if (row == null) {
                    continue;
                }
                Map<String, String> values = new LinkedHashMap<>();
                boolean blank = true;
                for (int c = 0; c < columns.size(); c++) {
                    String value = cellText(row.getCell(c)).strip();
                    blank &= value.isEmpty();
                    values.put(columns.get(c), value);
                }
                if (!blank) {
                    rows.add(Collections.unmodifiableMap(values));
                }
            }
            log.info("Loaded {} rows x {} columns from {} [{}]", rows.size(), columns.size(),
                    file.getFileName(), selected.getSheetName());
            return new DataTable(file.toString(), Collections.unmodifiableList(columns), Collections.unmodifiableList(rows));
        }
    }

    private Sheet selectSheet(Workbook workbook, String sheet, Path file) {
        if (sheet == null || sheet.isBlank()) {
            return workbook.getSheetAt(0);
        }
        Sheet byName = workbook.getSheet(sheet);
        if (byName != null) {
            return byName;
        }
        try {
            int index = Integer.parseInt(sheet.strip());
            if (index >= 0 && index < workbook.getNumberOfSheets()) {
                return workbook.getSheetAt(index);
            }
        } catch (NumberFormatException e) {
            log.debug("Sheet selector '{}' is not an index", sheet);
        }
        throw new TemplateProcessingException("DATA_SOURCE_UNREADABLE",
                "Sheet '" + sheet + "' not found in " + file.getFileName());
    }

    String cellText(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return isoDate(cell.getLocalDateTimeCellValue());
                }
                return formatter.formatRawCellContents(cell.getNumericCellValue(),
                        cell.getCellStyle().getDataFormat(), cell.getCellStyle().getDataFormatString());
            case STRING:
                return cell.getRichStringCellValue().getString();
            case BOOLEAN:
                return cell.getBooleanCellValue() ? "TRUE" : "FALSE";
            case ERROR:
            case BLANK:
            default:
                return "";
        }
    }

    private static String isoDate(LocalDateTime value) {
        if (value.toLocalTime().equals(LocalTime.MIDNIGHT)) {
            return value.toLocalDate().toString();
        }
        return value.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
