package com.nana.equip.domain;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ProjectEquipment: one individually trackable equipment instance of a
 * project (a {@code project_equipment} row).
 *
 * <p>The import expands a spreadsheet row of quantity N into N of these, each
 * with {@code plannedQuantity == 1}, a sequential {@code instanceNumber} and
 * a shared {@code parentImportGroup}. Procurement and installation state is
 * written later by other workflows; the import only ever preserves it.
 *
 * <p>FIELD GROUPS:
 * <pre>
 *   identity      id, projectId, roomId, csvBatchId
 *   catalog       name, description, manufacturer, model, partNumber,
 *                 equipmentType, installSide, unitOfMeasure, unitCost,
 *                 unitPrice, supplier, supplierId, globalPartId, metadata
 *   expansion     plannedQuantity, instanceNumber, instanceName,
 *                 parentImportGroup
 *   procurement   ordered/received quantities and dates, ordered and
 *                 delivered confirmations (flag, actor, time)
 *   installation  installed flag, actor, time
 * </pre>
 */
public class ProjectEquipment {

    // -----------------------------------------------------------------------
    // IDENTITY
    // -----------------------------------------------------------------------

    private String id;
    private String projectId;
    private String roomId;
    private String csvBatchId;

    // -----------------------------------------------------------------------
    // CATALOG DATA
    // -----------------------------------------------------------------------

    private String        name;
    private String        description;
    private String        manufacturer;
    private String        model;
    private String        partNumber;
    private InstallSide   installSide   = InstallSide.ROOM_END;
    private EquipmentType equipmentType = EquipmentType.PART;
    private String        unitOfMeasure = "ea";
    private double        unitCost;
    private double        unitPrice;
    private String        supplier;
    private String        supplierId;
    private String        globalPartId;
    private String        notes;
    private boolean       active = true;

    /** Free-form builder-specific attributes (vendor catalog fields). */
    private Map<String, Object> metadata = new LinkedHashMap<>();

    // -----------------------------------------------------------------------
    // INSTANCE EXPANSION
    // -----------------------------------------------------------------------

    private double plannedQuantity = 1;
    private int    instanceNumber  = 1;
    private String instanceName;
    private String parentImportGroup;

    // -----------------------------------------------------------------------
    // PROCUREMENT / INSTALLATION STATE
    // -----------------------------------------------------------------------

    private double        orderedQuantity;
    private LocalDate     orderedDate;
    private double        receivedQuantity;
    private LocalDate     receivedDate;
    private String        receivedBy;

    private boolean       orderedConfirmed;
    private LocalDateTime orderedConfirmedAt;
    private String        orderedConfirmedBy;

    private boolean       deliveredConfirmed;
    private LocalDateTime deliveredConfirmedAt;
    private String        deliveredConfirmedBy;

    private boolean       installed;
    private LocalDateTime installedAt;
    private String        installedBy;

    private String        createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    // -----------------------------------------------------------------------
    // BEHAVIOUR
    // -----------------------------------------------------------------------

    /** @return the natural key used to match this row across imports */
    public EquipmentKey naturalKey() {
        return EquipmentKey.of(this);
    }

    /**
     * Overlays the procurement and installation lifecycle of {@code existing}
     * onto this row. Used by Merge after the incoming spreadsheet values have
     * been applied, so a re-import never erases recorded progress.
     *
     * @param existing the stored row being updated in place
     */
    public void copyLifecycleStateFrom(ProjectEquipment existing) {
        this.orderedQuantity      = existing.orderedQuantity;
        this.orderedDate          = existing.orderedDate;
        this.receivedQuantity     = existing.receivedQuantity;
        this.receivedDate         = existing.receivedDate;
        this.receivedBy           = existing.receivedBy;
        this.orderedConfirmed     = existing.orderedConfirmed;
        this.orderedConfirmedAt   = existing.orderedConfirmedAt;
        this.orderedConfirmedBy   = existing.orderedConfirmedBy;
        this.deliveredConfirmed   = existing.deliveredConfirmed;
        this.deliveredConfirmedAt = existing.deliveredConfirmedAt;
        this.deliveredConfirmedBy = existing.deliveredConfirmedBy;
        this.installed            = existing.installed;
        this.installedAt          = existing.installedAt;
        this.installedBy          = existing.installedBy;
        this.createdBy            = existing.createdBy;
        this.createdAt            = existing.createdAt;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public String getId()                               { return id; }
    public void setId(String id)                        { this.id = id; }

    public String getProjectId()                        { return projectId; }
    public void setProjectId(String projectId)          { this.projectId = projectId; }

    public String getRoomId()                           { return roomId; }
    public void setRoomId(String roomId)                { this.roomId = roomId; }

    public String getCsvBatchId()                       { return csvBatchId; }
    public void setCsvBatchId(String csvBatchId)        { this.csvBatchId = csvBatchId; }

    public String getName()                             { return name; }
    public void setName(String name)                    { this.name = name; }

    public String getDescription()                      { return description; }
    public void setDescription(String description)      { this.description = description; }

    public String getManufacturer()                     { return manufacturer; }
    public void setManufacturer(String manufacturer)    { this.manufacturer = manufacturer; }

    public String getModel()                            { return model; }
    public void setModel(String model)                  { this.model = model; }

    public String getPartNumber()                       { return partNumber; }
    public void setPartNumber(String partNumber)        { this.partNumber = partNumber; }

    public InstallSide getInstallSide()                 { return installSide; }
    public void setInstallSide(InstallSide installSide) { this.installSide = installSide; }

    public EquipmentType getEquipmentType()             { return equipmentType; }
    public void setEquipmentType(EquipmentType type)    { this.equipmentType = type; }

    public String getUnitOfMeasure()                    { return unitOfMeasure; }
    public void setUnitOfMeasure(String unit)           { this.unitOfMeasure = unit; }

    public double getUnitCost()                         { return unitCost; }
    public void setUnitCost(double unitCost)            { this.unitCost = unitCost; }

    public double getUnitPrice()                        { return unitPrice; }
    public void setUnitPrice(double unitPrice)          { this.unitPrice = unitPrice; }

    public String getSupplier()                         { return supplier; }
    public void setSupplier(String supplier)            { this.supplier = supplier; }

    public String getSupplierId()                       { return supplierId; }
    public void setSupplierId(String supplierId)        { this.supplierId = supplierId; }

    public String getGlobalPartId()                     { return globalPartId; }
    public void setGlobalPartId(String globalPartId)    { this.globalPartId = globalPartId; }

    public String getNotes()                            { return notes; }
    public void setNotes(String notes)                  { this.notes = notes; }

    public boolean isActive()                           { return active; }
    public void setActive(boolean active)               { this.active = active; }

    public Map<String, Object> getMetadata()            { return metadata; }
    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? new LinkedHashMap<>() : metadata;
    }

    public double getPlannedQuantity()                  { return plannedQuantity; }
    public void setPlannedQuantity(double quantity)     { this.plannedQuantity = quantity; }

    public int getInstanceNumber()                      { return instanceNumber; }
    public void setInstanceNumber(int instanceNumber)   { this.instanceNumber = instanceNumber; }

    public String getInstanceName()                     { return instanceName; }
    public void setInstanceName(String instanceName)    { this.instanceName = instanceName; }

    public String getParentImportGroup()                { return parentImportGroup; }
    public void setParentImportGroup(String group)      { this.parentImportGroup = group; }

    public double getOrderedQuantity()                  { return orderedQuantity; }
    public void setOrderedQuantity(double quantity)     { this.orderedQuantity = quantity; }

    public LocalDate getOrderedDate()                   { return orderedDate; }
    public void setOrderedDate(LocalDate orderedDate)   { this.orderedDate = orderedDate; }

    public double getReceivedQuantity()                 { return receivedQuantity; }
    public void setReceivedQuantity(double quantity)    { this.receivedQuantity = quantity; }

    public LocalDate getReceivedDate()                  { return receivedDate; }
    public void setReceivedDate(LocalDate receivedDate) { this.receivedDate = receivedDate; }

    public String getReceivedBy()                       { return receivedBy; }
    public void setReceivedBy(String receivedBy)        { this.receivedBy = receivedBy; }

    public boolean isOrderedConfirmed()                 { return orderedConfirmed; }
    public void setOrderedConfirmed(boolean confirmed)  { this.orderedConfirmed = confirmed; }

    public LocalDateTime getOrderedConfirmedAt()        { return orderedConfirmedAt; }
    public void setOrderedConfirmedAt(LocalDateTime t)  { this.orderedConfirmedAt = t; }

    public String getOrderedConfirmedBy()               { return orderedConfirmedBy; }
    public void setOrderedConfirmedBy(String userId)    { this.orderedConfirmedBy = userId; }

    public boolean isDeliveredConfirmed()               { return deliveredConfirmed; }
    public void setDeliveredConfirmed(boolean flag)     { this.deliveredConfirmed = flag; }

    public LocalDateTime getDeliveredConfirmedAt()      { return deliveredConfirmedAt; }
    public void setDeliveredConfirmedAt(LocalDateTime t) { this.deliveredConfirmedAt = t; }

    public String getDeliveredConfirmedBy()             { return deliveredConfirmedBy; }
    public void setDeliveredConfirmedBy(String userId)  { this.deliveredConfirmedBy = userId; }

    public boolean isInstalled()                        { return installed; }
    public void setInstalled(boolean installed)         { this.installed = installed; }

    public LocalDateTime getInstalledAt()               { return installedAt; }
    public void setInstalledAt(LocalDateTime t)         { this.installedAt = t; }

    public String getInstalledBy()                      { return installedBy; }
    public void setInstalledBy(String userId)           { this.installedBy = userId; }

    public String getCreatedBy()                        { return createdBy; }
    public void setCreatedBy(String createdBy)          { this.createdBy = createdBy; }

    public LocalDateTime getCreatedAt()                 { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt)   { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt()                 { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt)   { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "ProjectEquipment{id='" + id + '\''
               + ", instance='" + instanceName + '\''
               + ", part='" + partNumber + '\''
               + ", room=" + roomId
               + ", side=" + installSide
               + ", type=" + equipmentType + '}';
    }
}
