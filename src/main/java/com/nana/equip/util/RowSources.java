package com.nana.equip.util;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Chooses a {@link RowSource} from a file's extension. Anything that is not
 * an Excel workbook is read as CSV.
 */
public final class RowSources {

    private RowSources() {
        throw new UnsupportedOperationException("RowSources is a utility class.");
    }

    public static RowSource forFile(Path file) {
        Path name = file == null ? null : file.getFileName();
        String lower = name == null ? "" : name.toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".xlsx") || lower.endsWith(".xls")) {
            return new XlsxRowSource();
        }
        return new CsvRowSource();
    }
}
