package com.nana.equip.util;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the first sheet of an Excel workbook ({@code .xlsx} or {@code .xls})
 * with Apache POI. The first non-blank row is the header and data starts on
 * the row after it. Cells are rendered as the user sees them through
 * {@link DataFormatter}, so currency and percentage formats come through as
 * text for the row normaliser to clean.
 */
public class XlsxRowSource implements RowSource {

    private static final Logger log = LoggerFactory.getLogger(XlsxRowSource.class);

    private final DataFormatter formatter = new DataFormatter();

    @Override
    public List<Map<String, String>> readRows(Path file) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>();
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                return rows;
            }
            Sheet sheet = workbook.getSheetAt(0);
            int headerIndex = headerRowIndex(sheet);
            if (headerIndex < 0) {
                return rows;
            }
            List<String> header = headerOf(sheet.getRow(headerIndex));

            for (int i = headerIndex + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;

                Map<String, String> values = new LinkedHashMap<>();
                boolean anyValue = false;
                for (int c = 0; c < header.size(); c++) {
                    if (header.get(c).isEmpty()) continue;
                    String text = cellText(row.getCell(c));
                    anyValue |= !text.isBlank();
                    values.put(header.get(c), text);
                }
                if (anyValue) {
                    rows.add(values);
                }
            }
        }
        log.debug("Read {} data row(s) from workbook {}.", rows.size(), file.getFileName());
        return rows;
    }

    @Override
    public String readText(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                return "";
            }
            Sheet sheet = workbook.getSheetAt(0);
            int headerIndex = headerRowIndex(sheet);
            return headerIndex < 0 ? "" : String.join(",", headerOf(sheet.getRow(headerIndex)));
        }
    }

    /** First row with a non-blank cell, or -1 for a sheet with no content. */
    private int headerRowIndex(Sheet sheet) {
        for (int i = Math.max(sheet.getFirstRowNum(), 0); i <= sheet.getLastRowNum(); i++) {
            Row row = sheet.getRow(i);
            if (row == null) continue;
            for (Cell cell : row) {
                if (!cellText(cell).isBlank()) {
                    return i;
                }
            }
        }
        return -1;
    }

    private List<String> headerOf(Row headerRow) {
        List<String> header = new ArrayList<>();
        short last = headerRow.getLastCellNum();
        for (int c = 0; c < last; c++) {
            header.add(cellText(headerRow.getCell(c)).trim());
        }
        return header;
    }

    private String cellText(Cell cell) {
        return cell == null ? "" : formatter.formatCellValue(cell);
    }
}
