package com.nana.equip.domain;

/**
 * A wire drop link captured before its equipment is deleted, together with
 * the identity fields of that equipment. The snapshot outlives the equipment
 * row so the link can be matched to its replacement by natural key.
 */
public final class LinkSnapshot {

    private final WireDropLink link;
    private final String       oldEquipmentId;
    private final String       oldName;
    private final String       oldPartNumber;
    private final String       oldRoomId;
    private final InstallSide  oldInstallSide;
    private final int          oldInstanceNumber;

    public LinkSnapshot(WireDropLink link,
                        String oldEquipmentId,
                        String oldName,
                        String oldPartNumber,
                        String oldRoomId,
                        InstallSide oldInstallSide,
                        int oldInstanceNumber) {
        this.link              = link;
        this.oldEquipmentId    = oldEquipmentId;
        this.oldName           = oldName;
        this.oldPartNumber     = oldPartNumber;
        this.oldRoomId         = oldRoomId;
        this.oldInstallSide    = oldInstallSide;
        this.oldInstanceNumber = oldInstanceNumber;
    }

    /** @return the natural key the deleted equipment had */
    public EquipmentKey oldKey() {
        return EquipmentKey.of(oldPartNumber, oldRoomId,
                oldInstallSide == null ? null : oldInstallSide.getDbValue(), oldName);
    }

    public WireDropLink getLink()        { return link; }
    public String getWireDropId()        { return link.getWireDropId(); }
    public String getOldEquipmentId()    { return oldEquipmentId; }
    public String getOldName()           { return oldName; }
    public String getOldPartNumber()     { return oldPartNumber; }
    public String getOldRoomId()         { return oldRoomId; }
    public InstallSide getOldInstallSide() { return oldInstallSide; }
    public int getOldInstanceNumber()    { return oldInstanceNumber; }

    @Override
    public String toString() {
        return "LinkSnapshot{wireDrop='" + link.getWireDropId()
               + "', oldEquipment='" + oldEquipmentId
               + "', part='" + oldPartNumber + "', name='" + oldName + "'}";
    }
}
