package com.nana.equip.service;

import com.nana.equip.domain.ProjectRoom;

import java.util.regex.Pattern;

/**
 * RowNormalizer: cell value cleaning shared by the record builders.
 *
 * <p>None of these methods throw. A malformed cost or quantity cell reads as
 * zero so that one bad cell does not abort an otherwise valid import.
 */
public final class RowNormalizer {

    /** Grouping key for rows whose room name normalizes to nothing. */
    public static final String UNKNOWN_ROOM_KEY = "unknown_room";

    private static final Pattern NUMBER_NOISE = Pattern.compile("[$,%\\s]");

    private RowNormalizer() {
        throw new UnsupportedOperationException("RowNormalizer is a utility class.");
    }

    /**
     * @param value raw cell text
     * @return the trimmed text, or null when absent or blank
     */
    public static String text(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Parses a currency, percentage or plain number. Dollar signs, percent
     * signs, thousands separators and whitespace are stripped first.
     *
     * @param value raw cell text
     * @return the parsed value, or 0 when absent or not numeric
     */
    public static double number(String value) {
        if (value == null) {
            return 0;
        }
        String cleaned = NUMBER_NOISE.matcher(value).replaceAll("");
        if (cleaned.isEmpty()) {
            return 0;
        }
        try {
            double parsed = Double.parseDouble(cleaned);
            return Double.isFinite(parsed) ? parsed : 0;
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    /**
     * Key used to match a raw room name against canonical rooms.
     *
     * @param roomName raw room name, may be null
     * @return {@link ProjectRoom#normalizeName(String)}, or
     *         {@link #UNKNOWN_ROOM_KEY} when that is empty
     */
    public static String roomKey(String roomName) {
        String normalized = ProjectRoom.normalizeName(text(roomName));
        return normalized.isEmpty() ? UNKNOWN_ROOM_KEY : normalized;
    }
}
