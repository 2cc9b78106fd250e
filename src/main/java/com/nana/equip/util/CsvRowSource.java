package com.nana.equip.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CsvRowSource: RFC 4180 reader for equipment proposal exports.
 *
 * <p>Handles the quirks real proposal exports carry:
 * <ul>
 *   <li>UTF-8 BOM at the start of the file</li>
 *   <li>Quoted fields containing commas or line breaks</li>
 *   <li>Escaped quotes ({@code ""} inside a quoted field)</li>
 *   <li>Windows CRLF and bare CR line endings</li>
 *   <li>Blank lines anywhere in the file</li>
 * </ul>
 *
 * <p>The first non-blank record is the header. Data records shorter than the
 * header get empty strings for the missing cells; extra cells are ignored.
 */
public class CsvRowSource implements RowSource {

    private static final Logger log = LoggerFactory.getLogger(CsvRowSource.class);

    private static final char BOM = '\uFEFF';

    @Override
    public List<Map<String, String>> readRows(Path file) throws IOException {
        String text = readText(file);
        List<List<String>> records;
        try {
            records = parseRecords(text);
        } catch (IllegalArgumentException ex) {
            throw new IOException("Malformed CSV in " + file.getFileName() + ": "
                                  + ex.getMessage(), ex);
        }

        List<Map<String, String>> rows = new ArrayList<>();
        if (records.isEmpty()) {
            return rows;
        }

        List<String> header = records.get(0).stream().map(String::trim).toList();
        for (int r = 1; r < records.size(); r++) {
            List<String> record = records.get(r);
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                if (header.get(c).isEmpty()) {
                    continue;
                }
                row.put(header.get(c), c < record.size() ? record.get(c) : "");
            }
            rows.add(row);
        }
        log.debug("Parsed {} data row(s) from {} ({} columns).",
                rows.size(), file.getFileName(), header.size());
        return rows;
    }

    @Override
    public String readText(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            log.debug("UTF-8 BOM detected and stripped.");
            text = text.substring(1);
        }
        return text;
    }

    // -----------------------------------------------------------------------
    // PARSER
    // -----------------------------------------------------------------------

    /**
     * Splits CSV text into records using a quote-aware state machine.
     * A quote inside an unquoted cell is kept as a literal character.
     * Records whose cells are all blank are dropped.
     *
     * @param text the full file content, BOM already removed
     * @return the parsed records in file order
     * @throws IllegalArgumentException if a quoted field is never closed
     */
    public List<List<String>> parseRecords(String text) {
        List<List<String>> records = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        int length = text.length();

        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);

            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < length && text.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
                continue;
            }

            switch (c) {
                case '"' -> {
                    // Only a leading quote opens a quoted field; inch marks stay literal.
                    if (current.length() == 0) {
                        inQuotes = true;
                    } else {
                        current.append(c);
                    }
                }
                case ',' -> {
                    fields.add(current.toString());
                    current.setLength(0);
                }
                case '\r', '\n' -> {
                    if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                        i++;
                    }
                    fields.add(current.toString());
                    current.setLength(0);
                    addIfNotBlank(records, fields);
                    fields = new ArrayList<>();
                }
                default -> current.append(c);
            }
        }

        if (inQuotes) {
            throw new IllegalArgumentException("unclosed quoted field at end of file");
        }
        if (current.length() > 0 || !fields.isEmpty()) {
            fields.add(current.toString());
            addIfNotBlank(records, fields);
        }
        return records;
    }

    private static void addIfNotBlank(List<List<String>> records, List<String> fields) {
        for (String field : fields) {
            if (!field.isBlank()) {
                records.add(fields);
                return;
            }
        }
    }
}
