package com.nana.equip.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvRowSourceTest {

    private final CsvRowSource source = new CsvRowSource();

    @Nested
    @DisplayName("CSV Parser Tests")
    class ParserTests {

        @Test
        @DisplayName("Quoted fields keep commas, doubled quotes and line breaks")
        void quotedFields() {
            List<List<String>> records = source.parseRecords(
                    "Name,Notes\n\"Speaker, 6.5\"\"\",\"line one\nline two\"\n");

            assertEquals(2, records.size());
            assertEquals(List.of("Speaker, 6.5\"", "line one\nline two"), records.get(1));
        }

        @Test
        @DisplayName("CRLF, CR and LF all end a record")
        void lineEndings() {
            assertEquals(4, source.parseRecords("a,b\r\n1,2\r3,4\n5,6").size());
        }

        @Test
        @DisplayName("Blank lines and all-empty records are dropped")
        void blankRecords() {
            List<List<String>> records = source.parseRecords("a,b\n\n,\n1,2\n");
            assertEquals(2, records.size());
        }

        @Test
        @DisplayName("Inch marks inside unquoted cells are literal and keep every row")
        void inchMarksInUnquotedCells() {
            List<List<String>> records = source.parseRecords(
                    "ItemType,Area,Quantity,Model\n"
                  + "Part,Living Room,1,TV 65\" Panel\n"
                  + "Part,Living Room,2,Speaker 8\" Ceiling\n"
                  + "Part,Rack,1,Amp\n");

            assertEquals(4, records.size());
            assertEquals("TV 65\" Panel", records.get(1).get(3));
            assertEquals(List.of("Part", "Living Room", "2", "Speaker 8\" Ceiling"), records.get(2));
            assertEquals("Amp", records.get(3).get(3));
        }

        @Test
        @DisplayName("An unclosed quote is rejected")
        void unclosedQuote() {
            assertThrows(IllegalArgumentException.class, () -> source.parseRecords("a,b\n\"oops,1\n"));
        }
    }

    @Nested
    @DisplayName("CSV File Reading Tests")
    class FileTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("The header row keys every data row; short rows are padded with empty cells")
        void headerKeyedRows() throws IOException {
            Path file = tempDir.resolve("proposal.csv");
            Files.writeString(file, "\uFEFFArea , ItemType,AreaQty\nLiving Room,Part,2\nKitchen,Labor\n",
                    StandardCharsets.UTF_8);

            List<Map<String, String>> rows = source.readRows(file);

            assertEquals(2, rows.size());
            assertEquals("Living Room", rows.get(0).get("Area"));
            assertEquals("2", rows.get(0).get("AreaQty"));
            assertEquals("", rows.get(1).get("AreaQty"));
        }

        @Test
        @DisplayName("readText strips the byte order mark")
        void bomStripped() throws IOException {
            Path file = tempDir.resolve("bom.csv");
            Files.writeString(file, "\uFEFFTechnology,Product", StandardCharsets.UTF_8);
            assertEquals("Technology,Product", source.readText(file));
        }

        @Test
        @DisplayName("Malformed CSV surfaces as an IOException")
        void malformedIsIoException() throws IOException {
            Path file = tempDir.resolve("bad.csv");
            Files.writeString(file, "a,b\n\"never closed", StandardCharsets.UTF_8);
            assertThrows(IOException.class, () -> source.readRows(file));
        }

        @Test
        @DisplayName("A header-only file has no data rows")
        void headerOnly() throws IOException {
            Path file = tempDir.resolve("empty.csv");
            Files.writeString(file, "Area,ItemType\n", StandardCharsets.UTF_8);
            assertTrue(source.readRows(file).isEmpty());
        }

        @Test
        @DisplayName("RowSources picks the workbook reader for Excel files")
        void rowSourceSelection() {
            assertInstanceOf(XlsxRowSource.class, RowSources.forFile(Path.of("a.XLSX")));
            assertInstanceOf(CsvRowSource.class, RowSources.forFile(Path.of("a.csv")));
        }
    }
}
