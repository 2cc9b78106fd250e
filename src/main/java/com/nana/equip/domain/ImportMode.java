package com.nana.equip.domain;

/**
 * ImportMode: how an import treats equipment that already exists for the
 * project.
 *
 * <ul>
 *   <li>{@code REPLACE}: the spreadsheet becomes the new source of truth.
 *       All project equipment is deleted and rebuilt; wire drop links are
 *       captured first and re-attached afterwards. Destructive: callers should
 *       confirm with the operator before choosing it.</li>
 *   <li>{@code MERGE}: rows matching an existing line by natural key are
 *       updated in place with procurement progress preserved; the rest are
 *       inserted.</li>
 *   <li>{@code APPEND}: every row is inserted, even when an equivalent line
 *       already exists.</li>
 * </ul>
 */
public enum ImportMode {

    REPLACE,
    MERGE,
    APPEND;

    /**
     * Lenient parse used by the command line and configuration.
     * Null or unknown text falls back to {@code REPLACE}.
     *
     * @param value mode name, any case
     * @return the mode
     */
    public static ImportMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return REPLACE;
        }
        for (ImportMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        return REPLACE;
    }
}
