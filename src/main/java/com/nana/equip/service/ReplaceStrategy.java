package com.nana.equip.service;

import com.nana.equip.domain.ImportMode;
import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.repository.EquipmentRepository;
import com.nana.equip.repository.LaborBudgetRepository;
import com.nana.equip.util.AppLogger;

import java.util.List;

/**
 * Treats the import as the new source of truth: deletes all of the
 * project's equipment (with its inventory, instance and wire drop link rows)
 * and all previously imported labor lines, then inserts every built record.
 *
 * <p>Links must be captured by {@link LinkPreservationService#capture} before
 * this runs; they are gone afterwards.
 */
public class ReplaceStrategy extends AbstractReconciliationStrategy {

    public ReplaceStrategy(EquipmentRepository equipmentRepository,
                           LaborBudgetRepository laborRepository,
                           String warehouse) {
        super(equipmentRepository, laborRepository, warehouse);
    }

    @Override
    public ImportMode mode() {
        return ImportMode.REPLACE;
    }

    @Override
    public ReconcileOutcome apply(String projectId,
                                  List<ProjectEquipment> equipment,
                                  List<LaborBudgetLine> labor) {
        int equipmentDeleted = equipmentRepository.deleteAllForProject(projectId);
        int laborDeleted     = laborRepository.deleteImportedForProject(projectId);
        AppLogger.logEvent("PROJECT_EQUIPMENT_CLEARED",
                "project=" + projectId + " equipment=" + equipmentDeleted + " labor=" + laborDeleted);

        insertWithInventory(equipment);
        laborRepository.insertAll(labor);

        return new ReconcileOutcome(equipment, List.of(), labor, List.of(),
                equipmentDeleted, laborDeleted);
    }
}
