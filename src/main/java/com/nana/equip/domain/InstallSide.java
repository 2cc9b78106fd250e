package com.nana.equip.domain;

/**
 * InstallSide: where a piece of equipment is physically installed.
 *
 * <p>{@code HEAD_END} equipment lives in the rack / network room,
 * {@code ROOM_END} equipment lives in the room it serves. The import derives
 * the side from the resolved room's {@code is_headend} flag.
 */
public enum InstallSide {

    HEAD_END("head_end"),
    ROOM_END("room_end");

    private final String dbValue;

    InstallSide(String dbValue) {
        this.dbValue = dbValue;
    }

    /** @return the value persisted in {@code install_side} columns */
    public String getDbValue() {
        return dbValue;
    }

    /**
     * Returns {@code HEAD_END} for a head-end room, {@code ROOM_END} otherwise
     * (including when there is no room at all).
     *
     * @param room resolved room, may be null
     * @return the install side
     */
    public static InstallSide forRoom(ProjectRoom room) {
        return room != null && room.isHeadend() ? HEAD_END : ROOM_END;
    }

    /**
     * Parses a stored value. Anything unrecognised, including null, is
     * treated as {@code ROOM_END}, matching the column default.
     *
     * @param value stored text
     * @return the matching side
     */
    public static InstallSide fromString(String value) {
        if (value != null) {
            for (InstallSide side : values()) {
                if (side.dbValue.equalsIgnoreCase(value.trim())) {
                    return side;
                }
            }
        }
        return ROOM_END;
    }

    @Override
    public String toString() {
        return dbValue;
    }
}
