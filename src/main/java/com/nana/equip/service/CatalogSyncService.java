package com.nana.equip.service;

import com.nana.equip.domain.GlobalPart;
import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.domain.SupplierMatch;
import com.nana.equip.repository.EquipmentRepository;
import com.nana.equip.repository.GlobalPartRepository;
import com.nana.equip.repository.LaborBudgetRepository;
import com.nana.equip.repository.RepositoryException;
import com.nana.equip.repository.SupplierMatcher;
import com.nana.equip.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CatalogSyncService: links imported rows to the global parts catalog and
 * to supplier records.
 *
 * <p>PARTS: records are deduplicated by trimmed, case-insensitive part number.
 * Each unique part number is upserted once and the catalog id is written to
 * every project row of the batch with that part number.
 *
 * <p>SUPPLIERS: every distinct non-blank supplier text across equipment and
 * labor is resolved once through the {@link SupplierMatcher} and the
 * supplier id is written to every row of the batch carrying that exact text.
 *
 * <p>Both passes are best-effort per unique value. A failure is logged,
 * recorded in the {@link SyncOutcome} and the pass moves on.
 */
public class CatalogSyncService {

    private static final Logger log = LoggerFactory.getLogger(CatalogSyncService.class);

    private final GlobalPartRepository  globalPartRepository;
    private final EquipmentRepository   equipmentRepository;
    private final LaborBudgetRepository laborRepository;
    private final SupplierMatcher       supplierMatcher;
    private final double                supplierThreshold;

    public CatalogSyncService(GlobalPartRepository globalPartRepository,
                              EquipmentRepository equipmentRepository,
                              LaborBudgetRepository laborRepository,
                              SupplierMatcher supplierMatcher,
                              double supplierThreshold) {
        this.globalPartRepository = globalPartRepository;
        this.equipmentRepository  = equipmentRepository;
        this.laborRepository      = laborRepository;
        this.supplierMatcher      = supplierMatcher;
        this.supplierThreshold    = supplierThreshold;
    }

    /**
     * @param projectId owning project
     * @param batchId   limits the fan-out updates to this batch's rows, may be null
     * @param equipment inserted and updated equipment, ids set
     * @param labor     inserted and updated labor lines, ids set
     * @return counts and per-value failures
     */
    public SyncOutcome sync(String projectId, String batchId,
                            List<ProjectEquipment> equipment, List<LaborBudgetLine> labor) {
        List<String> catalogFailures = new ArrayList<>();
        List<String> supplierFailures = new ArrayList<>();

        int parts = syncGlobalParts(projectId, batchId, equipment, catalogFailures);
        int[] suppliers = syncSuppliers(projectId, batchId, equipment, labor, supplierFailures);

        SyncOutcome outcome = new SyncOutcome(parts, suppliers[0], suppliers[1],
                catalogFailures, supplierFailures);
        log.info("Catalog sync for project {}: {}", projectId, outcome);
        return outcome;
    }

    // -----------------------------------------------------------------------
    // GLOBAL PARTS
    // -----------------------------------------------------------------------

    private int syncGlobalParts(String projectId, String batchId,
                                List<ProjectEquipment> equipment, List<String> failures) {
        Map<String, List<ProjectEquipment>> byPart = new LinkedHashMap<>();
        for (ProjectEquipment item : equipment) {
            String part = RowNormalizer.text(item.getPartNumber());
            if (part == null) continue;
            byPart.computeIfAbsent(part.toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(item);
        }

        int resolved = 0;
        for (List<ProjectEquipment> group : byPart.values()) {
            ProjectEquipment first = group.get(0);
            String partNumber = first.getPartNumber().trim();
            try {
                String globalPartId = globalPartRepository.upsertByPartNumber(GlobalPart.fromEquipment(first));
                equipmentRepository.assignGlobalPart(projectId, partNumber, batchId, globalPartId);
                group.forEach(item -> item.setGlobalPartId(globalPartId));
                resolved++;
            } catch (RepositoryException ex) {
                AppLogger.logWarningEvent("GLOBAL_PART_SYNC_FAILED",
                        "part=" + partNumber + " error=" + ex.getMessage());
                failures.add(partNumber + ": " + ex.getMessage());
            }
        }
        return resolved;
    }

    // -----------------------------------------------------------------------
    // SUPPLIERS
    // -----------------------------------------------------------------------

    /** @return {resolved, created} */
    private int[] syncSuppliers(String projectId, String batchId,
                                List<ProjectEquipment> equipment, List<LaborBudgetLine> labor,
                                List<String> failures) {
        Set<String> names = new LinkedHashSet<>();
        equipment.forEach(item -> addIfPresent(names, item.getSupplier()));
        labor.forEach(line -> addIfPresent(names, line.getSupplier()));

        int resolved = 0;
        int created = 0;
        for (String name : names) {
            try {
                SupplierMatch match = supplierMatcher.matchOrCreate(name, supplierThreshold);
                String supplierId = match.getSupplierId();
                equipmentRepository.assignSupplier(projectId, name, batchId, supplierId);
                laborRepository.assignSupplier(projectId, name, batchId, supplierId);
                equipment.stream().filter(e -> name.equals(e.getSupplier()))
                        .forEach(e -> e.setSupplierId(supplierId));
                labor.stream().filter(l -> name.equals(l.getSupplier()))
                        .forEach(l -> l.setSupplierId(supplierId));
                resolved++;
                if (match.isCreated()) {
                    created++;
                }
                log.debug("Supplier '{}' resolved: {}", name, match);
            } catch (RuntimeException ex) {
                AppLogger.logWarningEvent("SUPPLIER_SYNC_FAILED",
                        "supplier=" + name + " error=" + ex.getMessage());
                failures.add(name + ": " + ex.getMessage());
            }
        }
        return new int[] {resolved, created};
    }

    private static void addIfPresent(Set<String> names, String supplier) {
        String name = RowNormalizer.text(supplier);
        if (name != null) {
            names.add(name);
        }
    }
}
