package com.nana.equip.repository;

import com.nana.equip.domain.LaborBudgetLine;

import java.util.List;

/**
 * Persistence contract for a project's labor budget lines.
 */
public interface LaborBudgetRepository {

    List<LaborBudgetLine> findByProject(String projectId);

    /** @throws RepositoryException if any row fails; nothing is written */
    void insertAll(List<LaborBudgetLine> lines);

    /** @throws RepositoryException if any row fails; nothing is written */
    void updateAll(List<LaborBudgetLine> lines);

    /**
     * Deletes lines that came from an earlier import (those carrying a batch
     * id). Manually entered lines are kept.
     *
     * @return number of lines deleted
     */
    int deleteImportedForProject(String projectId);

    /**
     * Sets the supplier id on every line of the project whose supplier text
     * equals {@code supplierName}, limited to {@code batchId} when it is set.
     *
     * @return number of lines updated
     */
    int assignSupplier(String projectId, String supplierName, String batchId, String supplierId);
}
