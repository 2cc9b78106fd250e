package com.nana.equip.service;

import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.domain.ProjectEquipment;

import java.util.List;

/**
 * Output of a {@link RecordBuilder}: expanded equipment instances, aggregated
 * labor lines, and the number of source rows that were dropped.
 */
public final class BuildResult {

    private final List<ProjectEquipment> equipment;
    private final List<LaborBudgetLine>  labor;
    private final int                    skippedRows;

    public BuildResult(List<ProjectEquipment> equipment,
                       List<LaborBudgetLine> labor,
                       int skippedRows) {
        this.equipment   = equipment;
        this.labor       = labor;
        this.skippedRows = skippedRows;
    }

    public List<ProjectEquipment> getEquipment() { return equipment; }
    public List<LaborBudgetLine> getLabor()      { return labor; }
    public int getSkippedRows()                  { return skippedRows; }
}
