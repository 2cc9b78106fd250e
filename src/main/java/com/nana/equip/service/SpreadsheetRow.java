package com.nana.equip.service;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One data row of an import file with case-insensitive column lookup.
 * Accessors take a list of alternative column names and use the first one
 * holding a non-blank value.
 */
public final class SpreadsheetRow {

    private final int                 rowNumber;
    private final Map<String, String> cells;

    public SpreadsheetRow(int rowNumber, Map<String, String> raw) {
        this.rowNumber = rowNumber;
        TreeMap<String, String> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        raw.forEach((header, value) -> {
            if (header != null) {
                map.putIfAbsent(header.trim(), value);
            }
        });
        this.cells = Collections.unmodifiableMap(map);
    }

    /** @return the spreadsheet row number, counting the header as row 1 (first data row is 2) */
    public int getRowNumber() {
        return rowNumber;
    }

    public boolean hasColumn(String column) {
        return cells.containsKey(column);
    }

    /**
     * @param columns candidate column names in priority order
     * @return the first non-blank trimmed value, or null
     */
    public String text(String... columns) {
        for (String column : columns) {
            String value = RowNormalizer.text(cells.get(column));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * @param columns candidate column names in priority order
     * @return the first non-blank value parsed by {@link RowNormalizer#number(String)}, or 0
     */
    public double number(String... columns) {
        return RowNormalizer.number(text(columns));
    }

    @Override
    public String toString() {
        return "SpreadsheetRow{" + rowNumber + ": " + cells + '}';
    }
}
