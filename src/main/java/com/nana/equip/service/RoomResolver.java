package com.nana.equip.service;

import com.nana.equip.domain.ProjectRoom;
import com.nana.equip.domain.RoomAlias;
import com.nana.equip.repository.RepositoryException;
import com.nana.equip.repository.RoomRepository;
import com.nana.equip.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * RoomResolver: makes sure every room named in an import exists.
 *
 * <p>First pass: existing rooms are keyed by {@link RowNormalizer#roomKey};
 * each raw name whose key is unknown becomes a new room (head-end when its
 * name carries a head-end keyword). New rooms are written in one batch and a
 * failure there aborts the import.
 *
 * <p>Second pass: each distinct spelling that differs from its room's
 * canonical name is recorded as an alias. Aliases already pointing at the
 * same room are not rewritten, so resolving the same input twice writes
 * nothing the second time. Alias write failures are logged and returned in
 * {@link RoomResolution#getAliasFailures()}.
 */
public class RoomResolver {

    private static final Logger log = LoggerFactory.getLogger(RoomResolver.class);

    private final RoomRepository roomRepository;

    public RoomResolver(RoomRepository roomRepository) {
        this.roomRepository = roomRepository;
    }

    /**
     * @param projectId    the project the rooms belong to
     * @param rawRoomNames room text of every row, nulls and blanks allowed
     * @param userId       recorded as creator of new rooms, may be null
     * @return the room map and counts
     * @throws RepositoryException if loading rooms or inserting new rooms fails
     */
    public RoomResolution resolve(String projectId, List<String> rawRoomNames, String userId) {
        Map<String, ProjectRoom> roomsByKey = new LinkedHashMap<>();
        for (ProjectRoom room : roomRepository.findByProject(projectId)) {
            roomsByKey.putIfAbsent(RowNormalizer.roomKey(room.getName()), room);
        }

        List<ProjectRoom> newRooms = new ArrayList<>();
        for (String raw : rawRoomNames) {
            String name = RowNormalizer.text(raw);
            if (name == null) continue;
            String key = RowNormalizer.roomKey(name);
            if (roomsByKey.containsKey(key)) continue;

            ProjectRoom room = ProjectRoom.newFromImport(projectId, name, userId);
            roomsByKey.put(key, room);
            newRooms.add(room);
        }

        if (!newRooms.isEmpty()) {
            roomRepository.insertAll(newRooms);
            AppLogger.logEvent("ROOMS_CREATED",
                    "project=" + projectId + " count=" + newRooms.size());
        }

        List<String> aliasFailures = new ArrayList<>();
        int aliasesWritten = writeAliases(projectId, rawRoomNames, roomsByKey, aliasFailures);

        return new RoomResolution(roomsByKey, newRooms.size(), aliasesWritten, aliasFailures);
    }

    private int writeAliases(String projectId,
                             List<String> rawRoomNames,
                             Map<String, ProjectRoom> roomsByKey,
                             List<String> failures) {
        Map<String, String> existing = new HashMap<>();
        try {
            for (RoomAlias alias : roomRepository.findAliases(projectId)) {
                existing.put(alias.getNormalizedAlias(), alias.getRoomId());
            }
        } catch (RepositoryException ex) {
            log.warn("Could not load room aliases for project {}; skipping alias pass.", projectId, ex);
            failures.add("alias lookup failed: " + ex.getMessage());
            return 0;
        }

        List<RoomAlias> payload = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String raw : rawRoomNames) {
            String name = RowNormalizer.text(raw);
            if (name == null) continue;

            String normalizedAlias = ProjectRoom.normalizeAlias(name);
            if (normalizedAlias.isEmpty() || seen.contains(normalizedAlias)) continue;

            ProjectRoom room = roomsByKey.get(RowNormalizer.roomKey(name));
            if (room == null || room.getId() == null) continue;
            if (normalizedAlias.equals(ProjectRoom.normalizeAlias(room.getName()))) continue;

            seen.add(normalizedAlias);
            if (room.getId().equals(existing.get(normalizedAlias))) continue;
            payload.add(new RoomAlias(projectId, room.getId(), name, normalizedAlias));
        }

        if (payload.isEmpty()) {
            return 0;
        }
        try {
            roomRepository.upsertAliases(payload);
            log.debug("Recorded {} room alias(es) for project {}.", payload.size(), projectId);
            return payload.size();
        } catch (RepositoryException ex) {
            AppLogger.logWarningEvent("ROOM_ALIAS_UPSERT_FAILED",
                    "project=" + projectId + " aliases=" + payload.size() + " error=" + ex.getMessage());
            failures.add("alias upsert failed for " + payload.size() + " alias(es): " + ex.getMessage());
            return 0;
        }
    }
}
