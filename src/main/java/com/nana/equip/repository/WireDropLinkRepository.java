package com.nana.equip.repository;

import com.nana.equip.domain.LinkSnapshot;
import com.nana.equip.domain.WireDropLink;

import java.util.List;

/**
 * Persistence contract for wire drop to equipment links. Wire drops
 * themselves are owned by another part of the system and are referenced by id.
 */
public interface WireDropLinkRepository {

    /**
     * Captures every link whose equipment belongs to the project, together
     * with that equipment's identity fields.
     *
     * @param projectId the project
     * @return snapshots ordered by wire drop, side and sort order
     */
    List<LinkSnapshot> captureForProject(String projectId);

    List<WireDropLink> findByProject(String projectId);

    List<WireDropLink> findByEquipment(String equipmentId);

    /**
     * Inserts all links in one transaction and assigns their ids.
     *
     * @throws RepositoryException if any link fails; nothing is written
     */
    void insertAll(List<WireDropLink> links);
}
