package com.nana.equip.repository;

import com.nana.equip.domain.ProjectEquipment;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for project equipment instances and the inventory
 * rows that hang off them.
 *
 * <p>Batch writes are all-or-nothing: either every row in the list is
 * written or a {@link RepositoryException} is thrown and none are.
 */
public interface EquipmentRepository {

    /** @return the project's equipment ordered by instance number, then creation */
    List<ProjectEquipment> findByProject(String projectId);

    Optional<ProjectEquipment> findById(String equipmentId);

    /**
     * Inserts every row and assigns ids and timestamps.
     *
     * @throws RepositoryException if any row fails; nothing is written
     */
    void insertAll(List<ProjectEquipment> equipment);

    /**
     * Overwrites every column of each row (matched by id) with the object state.
     *
     * @throws RepositoryException if any row fails or no longer exists; nothing is written
     */
    void updateAll(List<ProjectEquipment> equipment);

    /**
     * Deletes every equipment row of the project together with its inventory
     * rows, instance rows and wire drop links.
     *
     * @return number of equipment rows deleted
     */
    int deleteAllForProject(String projectId);

    /**
     * Creates one zero-valued inventory row per equipment row in the given
     * warehouse. Rows that already have one for that warehouse are left alone.
     */
    void insertInventory(List<ProjectEquipment> equipment, String warehouse);

    /** @return number of inventory rows held for the equipment row */
    int countInventory(String equipmentId);

    /**
     * Points every project row with this part number (case-insensitive) at
     * the catalog entry. When {@code batchId} is set only that batch's rows change.
     *
     * @return number of rows updated
     */
    int assignGlobalPart(String projectId, String partNumber, String batchId, String globalPartId);

    /**
     * Sets the supplier id on every project row whose supplier text equals
     * {@code supplierName}. When {@code batchId} is set only that batch's rows change.
     *
     * @return number of rows updated
     */
    int assignSupplier(String projectId, String supplierName, String batchId, String supplierId);
}
