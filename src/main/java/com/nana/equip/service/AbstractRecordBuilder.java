package com.nana.equip.service;

import com.nana.equip.domain.ProjectEquipment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

/**
 * Quantity expansion shared by the record builders.
 */
public abstract class AbstractRecordBuilder implements RecordBuilder {

    public static final String UNNAMED_EQUIPMENT = "Unnamed Equipment";

    /** Largest instance count one row may expand into; larger rows are skipped. */
    public static final int MAX_INSTANCES_PER_ROW = 10_000;

    /**
     * Whole number of instances a row quantity produces: rounded to the
     * nearest integer, at least 1 for any positive quantity. Callers check
     * {@link #exceedsInstanceLimit(double)} first.
     */
    static int instanceCount(double quantity) {
        return Math.max(1, (int) Math.round(quantity));
    }

    static boolean exceedsInstanceLimit(double quantity) {
        return Math.round(quantity) > MAX_INSTANCES_PER_ROW;
    }

    /**
     * Copies {@code template} into {@code count} instance records sharing one
     * new parent import group.
     *
     * @param template    the fully populated record for one unit
     * @param count       number of instances to create
     * @param roomDisplay room name used in instance names
     * @param roomKey     normalized room key for numbering
     * @param partLabel   part number, or name when there is none
     * @param counter     the build's instance counter
     * @return the instances in instance-number order
     */
    protected List<ProjectEquipment> expand(ProjectEquipment template, int count,
                                            String roomDisplay, String roomKey,
                                            String partLabel, InstanceCounter counter) {
        String group = UUID.randomUUID().toString();
        List<ProjectEquipment> instances = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int number = counter.next(roomKey, partLabel);
            ProjectEquipment instance = copyOf(template);
            instance.setPlannedQuantity(1);
            instance.setInstanceNumber(number);
            instance.setInstanceName(roomDisplay + " - " + partLabel + " " + number);
            instance.setParentImportGroup(group);
            instances.add(instance);
        }
        return instances;
    }

    private static ProjectEquipment copyOf(ProjectEquipment t) {
        ProjectEquipment e = new ProjectEquipment();
        e.setProjectId(t.getProjectId());
        e.setRoomId(t.getRoomId());
        e.setCsvBatchId(t.getCsvBatchId());
        e.setName(t.getName());
        e.setDescription(t.getDescription());
        e.setManufacturer(t.getManufacturer());
        e.setModel(t.getModel());
        e.setPartNumber(t.getPartNumber());
        e.setInstallSide(t.getInstallSide());
        e.setEquipmentType(t.getEquipmentType());
        e.setUnitOfMeasure(t.getUnitOfMeasure());
        e.setUnitCost(t.getUnitCost());
        e.setUnitPrice(t.getUnitPrice());
        e.setSupplier(t.getSupplier());
        e.setNotes(t.getNotes());
        e.setActive(t.isActive());
        e.setMetadata(new LinkedHashMap<>(t.getMetadata()));
        e.setCreatedBy(t.getCreatedBy());
        return e;
    }
}
