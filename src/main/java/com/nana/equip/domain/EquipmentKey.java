package com.nana.equip.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * EquipmentKey: natural key that bridges an equipment row across imports.
 *
 * <p>Re-imports regenerate equipment ids, so old and new rows are matched on
 * {@code (part number, room id, install side, name)} instead. Part number and
 * name are trimmed and lower-cased, a missing install side counts as
 * {@code room_end} and a missing room is a legitimate key component
 * (unassigned equipment).
 *
 * <p>Instances are immutable and compare by all four normalized components.
 */
public final class EquipmentKey {

    private final String partNumber;
    private final String roomId;
    private final String installSide;
    private final String name;

    private EquipmentKey(String partNumber, String roomId, String installSide, String name) {
        this.partNumber  = partNumber;
        this.roomId      = roomId;
        this.installSide = installSide;
        this.name        = name;
    }

    /**
     * Builds a key from raw component values.
     *
     * @param partNumber  part number, may be null
     * @param roomId      room id, may be null
     * @param installSide stored install side text, may be null
     * @param name        equipment name, may be null
     * @return the normalized key
     */
    public static EquipmentKey of(String partNumber, String roomId,
                                  String installSide, String name) {
        String side = installSide == null || installSide.isBlank()
                ? InstallSide.ROOM_END.getDbValue()
                : installSide.trim();
        String room = roomId == null || roomId.isBlank() ? null : roomId;
        return new EquipmentKey(clean(partNumber), room, side, clean(name));
    }

    /**
     * @param equipment an existing or freshly built equipment row
     * @return the key of that row
     */
    public static EquipmentKey of(ProjectEquipment equipment) {
        InstallSide side = equipment.getInstallSide();
        return of(equipment.getPartNumber(),
                  equipment.getRoomId(),
                  side == null ? null : side.getDbValue(),
                  equipment.getName());
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    public String getPartNumber()  { return partNumber; }
    public String getRoomId()      { return roomId; }
    public String getInstallSide() { return installSide; }
    public String getName()        { return name; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EquipmentKey other)) return false;
        return partNumber.equals(other.partNumber)
               && Objects.equals(roomId, other.roomId)
               && installSide.equals(other.installSide)
               && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partNumber, roomId, installSide, name);
    }

    @Override
    public String toString() {
        return "EquipmentKey{part='" + partNumber + "', room=" + roomId
               + ", side=" + installSide + ", name='" + name + "'}";
    }
}
