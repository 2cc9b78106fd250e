package com.nana.equip.service;

import com.nana.equip.domain.ImportMode;
import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.repository.EquipmentRepository;
import com.nana.equip.repository.LaborBudgetRepository;

import java.util.List;

/**
 * Inserts every built record as a new row, even when an equivalent row
 * already exists. Nothing is deleted or updated.
 */
public class AppendStrategy extends AbstractReconciliationStrategy {

    public AppendStrategy(EquipmentRepository equipmentRepository,
                          LaborBudgetRepository laborRepository,
                          String warehouse) {
        super(equipmentRepository, laborRepository, warehouse);
    }

    @Override
    public ImportMode mode() {
        return ImportMode.APPEND;
    }

    @Override
    public ReconcileOutcome apply(String projectId,
                                  List<ProjectEquipment> equipment,
                                  List<LaborBudgetLine> labor) {
        insertWithInventory(equipment);
        laborRepository.insertAll(labor);
        return new ReconcileOutcome(equipment, List.of(), labor, List.of(), 0, 0);
    }
}
