package com.nana.equip.domain;

import java.util.Locale;

/**
 * LaborBudgetLine: planned labor hours for one room and labor type.
 *
 * <p>Within one import every labor row sharing room, labor type and
 * description accumulates into a single line; its quantity adds to
 * {@code plannedHours}.
 */
public class LaborBudgetLine {

    private String id;
    private String projectId;
    private String roomId;
    private String laborType;
    private String description;
    private double plannedHours;
    private double actualHours;
    private double hourlyRate;
    private String supplier;
    private String supplierId;
    private String csvBatchId;
    private String notes;
    private String createdBy;

    /**
     * Key used by Merge to find the stored line an incoming one replaces:
     * {@code labor type | room id}.
     *
     * @return match key, never null
     */
    public String mergeKey() {
        String type = laborType == null ? "" : laborType.trim().toLowerCase(Locale.ROOT);
        return type + "|" + (roomId == null ? "null" : roomId);
    }

    /**
     * Adds hours from another source row of the same budget line.
     *
     * @param hours quantity of the source row
     */
    public void addPlannedHours(double hours) {
        this.plannedHours += hours;
    }

    public String getId()                       { return id; }
    public void setId(String id)                { this.id = id; }

    public String getProjectId()                { return projectId; }
    public void setProjectId(String projectId)  { this.projectId = projectId; }

    public String getRoomId()                   { return roomId; }
    public void setRoomId(String roomId)        { this.roomId = roomId; }

    public String getLaborType()                { return laborType; }
    public void setLaborType(String laborType)  { this.laborType = laborType; }

    public String getDescription()              { return description; }
    public void setDescription(String d)        { this.description = d; }

    public double getPlannedHours()             { return plannedHours; }
    public void setPlannedHours(double hours)   { this.plannedHours = hours; }

    public double getActualHours()              { return actualHours; }
    public void setActualHours(double hours)    { this.actualHours = hours; }

    public double getHourlyRate()               { return hourlyRate; }
    public void setHourlyRate(double rate)      { this.hourlyRate = rate; }

    public String getSupplier()                 { return supplier; }
    public void setSupplier(String supplier)    { this.supplier = supplier; }

    public String getSupplierId()               { return supplierId; }
    public void setSupplierId(String id)        { this.supplierId = id; }

    public String getCsvBatchId()               { return csvBatchId; }
    public void setCsvBatchId(String batchId)   { this.csvBatchId = batchId; }

    public String getNotes()                    { return notes; }
    public void setNotes(String notes)          { this.notes = notes; }

    public String getCreatedBy()                { return createdBy; }
    public void setCreatedBy(String createdBy)  { this.createdBy = createdBy; }

    @Override
    public String toString() {
        return "LaborBudgetLine{type='" + laborType + "', room=" + roomId
               + ", hours=" + plannedHours + ", rate=" + hourlyRate + '}';
    }
}
