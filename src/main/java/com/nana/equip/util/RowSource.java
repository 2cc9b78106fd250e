package com.nana.equip.util;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Produces the data rows of a tabular file as header-keyed maps.
 *
 * <p>Implementations keep the header spelling exactly as it appears in the
 * file and preserve row order. Blank rows are not returned.
 */
public interface RowSource {

    /**
     * Reads every data row of {@code file}.
     *
     * @param file the spreadsheet to read
     * @return ordered rows, each an insertion-ordered header to cell text map
     * @throws IOException if the file cannot be read or is malformed
     */
    List<Map<String, String>> readRows(Path file) throws IOException;

    /**
     * Returns raw text that format detection can inspect: the whole file for
     * delimited text, the header row for workbooks.
     *
     * @param file the spreadsheet to read
     * @return the inspectable text, never null
     * @throws IOException if the file cannot be read
     */
    String readText(Path file) throws IOException;
}
