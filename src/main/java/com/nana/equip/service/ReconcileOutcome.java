package com.nana.equip.service;

import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.domain.ProjectEquipment;

import java.util.List;
import java.util.stream.Stream;

/**
 * What a {@link ReconciliationStrategy} wrote. Inserted and updated rows
 * carry their persisted ids.
 */
public final class ReconcileOutcome {

    private final List<ProjectEquipment> insertedEquipment;
    private final List<ProjectEquipment> updatedEquipment;
    private final List<LaborBudgetLine>  insertedLabor;
    private final List<LaborBudgetLine>  updatedLabor;
    private final int                    equipmentDeleted;
    private final int                    laborDeleted;

    public ReconcileOutcome(List<ProjectEquipment> insertedEquipment,
                            List<ProjectEquipment> updatedEquipment,
                            List<LaborBudgetLine> insertedLabor,
                            List<LaborBudgetLine> updatedLabor,
                            int equipmentDeleted,
                            int laborDeleted) {
        this.insertedEquipment = List.copyOf(insertedEquipment);
        this.updatedEquipment  = List.copyOf(updatedEquipment);
        this.insertedLabor     = List.copyOf(insertedLabor);
        this.updatedLabor      = List.copyOf(updatedLabor);
        this.equipmentDeleted  = equipmentDeleted;
        this.laborDeleted      = laborDeleted;
    }

    public List<ProjectEquipment> getInsertedEquipment() { return insertedEquipment; }
    public List<ProjectEquipment> getUpdatedEquipment()  { return updatedEquipment; }
    public List<LaborBudgetLine> getInsertedLabor()      { return insertedLabor; }
    public List<LaborBudgetLine> getUpdatedLabor()       { return updatedLabor; }
    public int getEquipmentDeleted()                     { return equipmentDeleted; }
    public int getLaborDeleted()                         { return laborDeleted; }

    /** @return inserted followed by updated equipment */
    public List<ProjectEquipment> getWrittenEquipment() {
        return concat(insertedEquipment, updatedEquipment);
    }

    /** @return inserted followed by updated labor lines */
    public List<LaborBudgetLine> getWrittenLabor() {
        return concat(insertedLabor, updatedLabor);
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        return Stream.concat(first.stream(), second.stream()).toList();
    }
}
