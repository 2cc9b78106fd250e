package com.nana.equip.service;

import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.repository.EquipmentRepository;
import com.nana.equip.repository.LaborBudgetRepository;

import java.util.List;

/**
 * Repository wiring and the insert-with-inventory step shared by the
 * strategies.
 */
public abstract class AbstractReconciliationStrategy implements ReconciliationStrategy {

    protected final EquipmentRepository   equipmentRepository;
    protected final LaborBudgetRepository laborRepository;
    protected final String                warehouse;

    protected AbstractReconciliationStrategy(EquipmentRepository equipmentRepository,
                                             LaborBudgetRepository laborRepository,
                                             String warehouse) {
        this.equipmentRepository = equipmentRepository;
        this.laborRepository     = laborRepository;
        this.warehouse           = warehouse;
    }

    protected void insertWithInventory(List<ProjectEquipment> equipment) {
        if (equipment.isEmpty()) {
            return;
        }
        equipmentRepository.insertAll(equipment);
        equipmentRepository.insertInventory(equipment, warehouse);
    }
}
