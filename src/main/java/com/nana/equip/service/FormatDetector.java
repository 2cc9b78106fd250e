package com.nana.equip.service;

import java.util.List;

/**
 * Chooses the record builder for a file by looking for the vendor catalog's
 * column markers in the raw text. All three markers must be present;
 * anything else is a standard import.
 */
public class FormatDetector {

    public static final List<String> VENDOR_CATALOG_MARKERS =
            List.of("Technology", "Product", "System Mount");

    /**
     * @param rawText file text, or the header row of a workbook; may be null
     * @return {@link ImportFormat#VENDOR_CATALOG} when every marker occurs,
     *         otherwise {@link ImportFormat#STANDARD}
     */
    public ImportFormat detect(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return ImportFormat.STANDARD;
        }
        for (String marker : VENDOR_CATALOG_MARKERS) {
            if (!rawText.contains(marker)) {
                return ImportFormat.STANDARD;
            }
        }
        return ImportFormat.VENDOR_CATALOG;
    }
}
