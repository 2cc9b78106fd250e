package com.nana.equip.service;

import com.nana.equip.domain.ImportMode;
import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.domain.ProjectEquipment;

import java.util.List;

/**
 * Decides, for each built record, whether it is inserted, updated in place
 * or left alone, and writes the result.
 *
 * <p>Equipment and labor writes are fail-fast: any
 * {@link com.nana.equip.repository.RepositoryException} propagates and
 * aborts the import. Every newly inserted equipment row gets one zero-valued
 * inventory row.
 */
public interface ReconciliationStrategy {

    ImportMode mode();

    /**
     * @param projectId the project being imported into
     * @param equipment built equipment instances, ids unset
     * @param labor     built labor lines, ids unset
     * @return what was written
     */
    ReconcileOutcome apply(String projectId,
                           List<ProjectEquipment> equipment,
                           List<LaborBudgetLine> labor);
}
