package com.nana.equip.repository;

import com.nana.equip.domain.ProjectRoom;
import com.nana.equip.domain.RoomAlias;

import java.util.List;

/**
 * Persistence contract for project rooms and their spelling aliases.
 */
public interface RoomRepository {

    List<ProjectRoom> findByProject(String projectId);

    /**
     * Inserts all rooms in one transaction and assigns their ids.
     *
     * @param rooms new rooms, each with a distinct normalized name
     * @return the inserted rooms with ids set
     * @throws RepositoryException if any insert fails; nothing is written
     */
    List<ProjectRoom> insertAll(List<ProjectRoom> rooms);

    List<RoomAlias> findAliases(String projectId);

    /**
     * Inserts or repoints aliases keyed by (project, normalized alias). An
     * existing alias with the same key is moved to the new room.
     *
     * @param aliases aliases to write
     * @throws RepositoryException if the batch fails; nothing is written
     */
    void upsertAliases(List<RoomAlias> aliases);
}
