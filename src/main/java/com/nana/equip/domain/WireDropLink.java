package com.nana.equip.domain;

import java.time.LocalDateTime;

/**
 * WireDropLink: cross-reference from an externally managed wire drop to a
 * project equipment row.
 *
 * <p>These rows are the referential data a Replace import must not lose: they
 * are captured before the equipment is deleted and re-created afterwards.
 */
public class WireDropLink {

    private String        id;
    private String        wireDropId;
    private String        equipmentId;
    private String        linkSide = InstallSide.ROOM_END.getDbValue();
    private int           sortOrder;
    private double        quantity = 1;
    private String        notes;
    private String        createdBy;
    private LocalDateTime createdAt;

    public WireDropLink() {
    }

    public WireDropLink(String wireDropId, String equipmentId) {
        this.wireDropId  = wireDropId;
        this.equipmentId = equipmentId;
    }

    /**
     * Copies the link's own data onto a new equipment id. The id and
     * creation time are left empty so the store assigns fresh ones.
     *
     * @param newEquipmentId equipment the copy should point at
     * @return an unsaved copy
     */
    public WireDropLink retarget(String newEquipmentId) {
        WireDropLink copy = new WireDropLink(wireDropId, newEquipmentId);
        copy.setLinkSide(linkSide);
        copy.setSortOrder(sortOrder);
        copy.setQuantity(quantity);
        copy.setNotes(notes);
        copy.setCreatedBy(createdBy);
        return copy;
    }

    public String getId()                         { return id; }
    public void setId(String id)                  { this.id = id; }

    public String getWireDropId()                 { return wireDropId; }
    public void setWireDropId(String wireDropId)  { this.wireDropId = wireDropId; }

    public String getEquipmentId()                { return equipmentId; }
    public void setEquipmentId(String id)         { this.equipmentId = id; }

    public String getLinkSide()                   { return linkSide; }
    public void setLinkSide(String linkSide)      { this.linkSide = linkSide; }

    public int getSortOrder()                     { return sortOrder; }
    public void setSortOrder(int sortOrder)       { this.sortOrder = sortOrder; }

    public double getQuantity()                   { return quantity; }
    public void setQuantity(double quantity)      { this.quantity = quantity; }

    public String getNotes()                      { return notes; }
    public void setNotes(String notes)            { this.notes = notes; }

    public String getCreatedBy()                  { return createdBy; }
    public void setCreatedBy(String createdBy)    { this.createdBy = createdBy; }

    public LocalDateTime getCreatedAt()           { return createdAt; }
    public void setCreatedAt(LocalDateTime t)     { this.createdAt = t; }

    @Override
    public String toString() {
        return "WireDropLink{wireDrop='" + wireDropId + "', equipment='" + equipmentId
               + "', side=" + linkSide + '}';
    }
}
