package com.nana.equip.service;

import com.nana.equip.domain.EquipmentKey;
import com.nana.equip.domain.ImportMode;
import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.repository.EquipmentRepository;
import com.nana.equip.repository.LaborBudgetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MergeStrategy: updates matching rows in place and inserts the rest.
 *
 * <p>EQUIPMENT:
 * Existing rows are grouped by {@link EquipmentKey} in instance-number order.
 * Each incoming instance takes the next unclaimed existing row with its key,
 * so an existing row is updated at most once; incoming instances beyond the
 * existing count are inserted. A matched row takes the incoming catalog
 * fields but keeps its procurement and installation state
 * ({@link ProjectEquipment#copyLifecycleStateFrom}). Catalog and supplier ids
 * are kept when the incoming record has none.
 *
 * <p>LABOR:
 * Matched on {@link LaborBudgetLine#mergeKey()} (labor type, room). Planned
 * hours and rate are overwritten; actual hours, notes and creator are kept.
 */
public class MergeStrategy extends AbstractReconciliationStrategy {

    private static final Logger log = LoggerFactory.getLogger(MergeStrategy.class);

    public MergeStrategy(EquipmentRepository equipmentRepository,
                         LaborBudgetRepository laborRepository,
                         String warehouse) {
        super(equipmentRepository, laborRepository, warehouse);
    }

    @Override
    public ImportMode mode() {
        return ImportMode.MERGE;
    }

    @Override
    public ReconcileOutcome apply(String projectId,
                                  List<ProjectEquipment> equipment,
                                  List<LaborBudgetLine> labor) {
        List<ProjectEquipment> equipmentInserts = new ArrayList<>();
        List<ProjectEquipment> equipmentUpdates = new ArrayList<>();
        splitEquipment(projectId, equipment, equipmentInserts, equipmentUpdates);

        equipmentRepository.updateAll(equipmentUpdates);
        insertWithInventory(equipmentInserts);

        List<LaborBudgetLine> laborInserts = new ArrayList<>();
        List<LaborBudgetLine> laborUpdates = new ArrayList<>();
        splitLabor(projectId, labor, laborInserts, laborUpdates);

        laborRepository.updateAll(laborUpdates);
        laborRepository.insertAll(laborInserts);

        log.info("Merge for project {}: equipment {} inserted / {} updated, labor {} inserted / {} updated.",
                projectId, equipmentInserts.size(), equipmentUpdates.size(),
                laborInserts.size(), laborUpdates.size());
        return new ReconcileOutcome(equipmentInserts, equipmentUpdates,
                laborInserts, laborUpdates, 0, 0);
    }

    // -----------------------------------------------------------------------
    // EQUIPMENT
    // -----------------------------------------------------------------------

    private void splitEquipment(String projectId, List<ProjectEquipment> incoming,
                                List<ProjectEquipment> inserts, List<ProjectEquipment> updates) {
        if (incoming.isEmpty()) {
            return;
        }
        Map<EquipmentKey, Deque<ProjectEquipment>> existingByKey = new HashMap<>();
        equipmentRepository.findByProject(projectId).stream()
                .sorted(Comparator.comparingInt(ProjectEquipment::getInstanceNumber))
                .forEach(row -> existingByKey
                        .computeIfAbsent(row.naturalKey(), k -> new ArrayDeque<>())
                        .addLast(row));

        for (ProjectEquipment record : incoming) {
            Deque<ProjectEquipment> candidates = existingByKey.get(record.naturalKey());
            ProjectEquipment existing = candidates == null ? null : candidates.pollFirst();
            if (existing == null) {
                inserts.add(record);
                continue;
            }
            record.setId(existing.getId());
            record.copyLifecycleStateFrom(existing);
            if (record.getGlobalPartId() == null) {
                record.setGlobalPartId(existing.getGlobalPartId());
            }
            if (record.getSupplierId() == null) {
                record.setSupplierId(existing.getSupplierId());
            }
            if (record.getNotes() == null) {
                record.setNotes(existing.getNotes());
            }
            updates.add(record);
        }
    }

    // -----------------------------------------------------------------------
    // LABOR
    // -----------------------------------------------------------------------

    private void splitLabor(String projectId, List<LaborBudgetLine> incoming,
                            List<LaborBudgetLine> inserts, List<LaborBudgetLine> updates) {
        if (incoming.isEmpty()) {
            return;
        }
        Map<String, LaborBudgetLine> existingByKey = new LinkedHashMap<>();
        for (LaborBudgetLine line : laborRepository.findByProject(projectId)) {
            existingByKey.putIfAbsent(line.mergeKey(), line);
        }

        Set<String> claimed = new HashSet<>();
        for (LaborBudgetLine line : incoming) {
            LaborBudgetLine existing = existingByKey.get(line.mergeKey());
            if (existing == null || !claimed.add(existing.getId())) {
                inserts.add(line);
                continue;
            }
            line.setId(existing.getId());
            line.setActualHours(existing.getActualHours());
            line.setCreatedBy(existing.getCreatedBy());
            if (line.getNotes() == null) {
                line.setNotes(existing.getNotes());
            }
            if (line.getSupplierId() == null) {
                line.setSupplierId(existing.getSupplierId());
            }
            updates.add(line);
        }
    }
}
