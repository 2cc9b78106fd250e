package com.nana.equip.util;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class XlsxRowSourceTest {

    @TempDir
    Path tempDir;

    private Path writeWorkbook() throws IOException {
        Path file = tempDir.resolve("shades.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet("Schedule");
            Row header = sheet.createRow(0);
            String[] columns = {"Area", "Technology", "Product", "System Mount", "Quantity"};
            for (int c = 0; c < columns.length; c++) {
                header.createCell(c).setCellValue(columns[c]);
            }
            Row data = sheet.createRow(1);
            data.createCell(0).setCellValue("Bedroom");
            data.createCell(1).setCellValue("Sivoia QS");
            data.createCell(2).setCellValue("Roller 64");
            data.createCell(3).setCellValue("Inside");
            data.createCell(4).setCellValue(2);
            sheet.createRow(2);
            workbook.write(out);
        }
        return file;
    }

    @Test
    @DisplayName("Rows of the first sheet are keyed by its header; empty rows are skipped")
    void readsFirstSheet() throws IOException {
        List<Map<String, String>> rows = new XlsxRowSource().readRows(writeWorkbook());

        assertEquals(1, rows.size());
        assertEquals("Bedroom", rows.get(0).get("Area"));
        assertEquals("2", rows.get(0).get("Quantity"));
    }

    @Test
    @DisplayName("readText exposes the header row for format detection")
    void headerText() throws IOException {
        assertEquals("Area,Technology,Product,System Mount,Quantity",
                new XlsxRowSource().readText(writeWorkbook()));
    }

    @Test
    @DisplayName("A header below a blank first row is not repeated as data")
    void headerBelowBlankRow() throws IOException {
        Path file = tempDir.resolve("offset.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet("Proposal");
            sheet.createRow(0).createCell(0).setCellValue("");
            Row header = sheet.createRow(1);
            header.createCell(0).setCellValue("ItemType");
            header.createCell(1).setCellValue("Area");
            Row data = sheet.createRow(2);
            data.createCell(0).setCellValue("Part");
            data.createCell(1).setCellValue("Kitchen");
            workbook.write(out);
        }

        XlsxRowSource source = new XlsxRowSource();
        List<Map<String, String>> rows = source.readRows(file);

        assertEquals(1, rows.size());
        assertEquals(Map.of("ItemType", "Part", "Area", "Kitchen"), rows.get(0));
        assertEquals("ItemType,Area", source.readText(file));
    }

    @Test
    @DisplayName("A file that is not a workbook fails with an IOException")
    void notAWorkbook() throws IOException {
        Path file = tempDir.resolve("fake.xlsx");
        Files.writeString(file, "Area,ItemType\n");
        assertThrows(IOException.class, () -> new XlsxRowSource().readRows(file));
    }
}
