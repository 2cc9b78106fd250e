package com.nana.equip.service;

import com.nana.equip.domain.ProjectRoom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link RoomResolver#resolve}: canonical rooms keyed by
 * {@link RowNormalizer#roomKey(String)}, plus what the resolution wrote.
 * Alias failures are reported here instead of being thrown.
 */
public final class RoomResolution {

    private final Map<String, ProjectRoom> roomsByKey;
    private final int                      roomsCreated;
    private final int                      aliasesWritten;
    private final List<String>             aliasFailures;

    public RoomResolution(Map<String, ProjectRoom> roomsByKey,
                          int roomsCreated,
                          int aliasesWritten,
                          List<String> aliasFailures) {
        this.roomsByKey     = Collections.unmodifiableMap(new LinkedHashMap<>(roomsByKey));
        this.roomsCreated   = roomsCreated;
        this.aliasesWritten = aliasesWritten;
        this.aliasFailures  = List.copyOf(aliasFailures);
    }

    /** An empty resolution, for building records without a store. */
    public static RoomResolution of(Map<String, ProjectRoom> roomsByKey) {
        return new RoomResolution(roomsByKey, 0, 0, List.of());
    }

    /**
     * @param rawRoomName the room text from a row
     * @return the canonical room, or null if the name was never resolved
     */
    public ProjectRoom roomFor(String rawRoomName) {
        return roomsByKey.get(RowNormalizer.roomKey(rawRoomName));
    }

    public Map<String, ProjectRoom> getRoomsByKey() { return roomsByKey; }
    public int getRoomsCreated()                     { return roomsCreated; }
    public int getAliasesWritten()                   { return aliasesWritten; }
    public List<String> getAliasFailures()           { return aliasFailures; }
}
